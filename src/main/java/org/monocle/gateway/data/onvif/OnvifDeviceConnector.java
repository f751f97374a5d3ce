/***********************************************************************
 * This file is part of Monocle Gateway.
 *
 * Monocle Gateway is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Monocle Gateway is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Monocle Gateway.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.monocle.gateway.data.onvif;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.monocle.gateway.common.LoginParam;
import org.monocle.gateway.data.PtzDeviceConnector;
import org.monocle.gateway.data.Velocity;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.monocle.gateway.data.onvif.SoapEnvelope.DEVICE_NS;
import static org.monocle.gateway.data.onvif.SoapEnvelope.MEDIA_NS;
import static org.monocle.gateway.data.onvif.SoapEnvelope.PTZ_NS;
import static org.monocle.gateway.data.onvif.SoapEnvelope.SCHEMA_NS;
import static org.monocle.gateway.data.onvif.SoapEnvelope.escape;

/**
 * The OnvifDeviceConnector class controls a camera through its ONVIF device,
 * media and PTZ services, speaking SOAP over HTTP.
 * <p>
 * {@link #init()} asks the device service for the device information and the
 * service addresses, then takes the first media profile as the profile of all
 * PTZ requests. PTZ is supported only if the device announces a PTZ service
 * and has at least one profile.
 */
public class OnvifDeviceConnector extends PtzDeviceConnector {

    private static final String CONTENT_TYPE = "application/soap+xml; charset=utf-8";

    private final HttpClient client;
    private final int requestTimeout;
    private final Logger logger;
    private final String deviceAddress;

    private volatile String ptzAddress = null;
    private volatile String profileToken = null;

    /**
     * Create a factory of ONVIF connectors sharing a Vert.x instance.
     *
     * @param vertx          Vert.x instance to run the HTTP clients on.
     * @param requestTimeout timeout of each request in milliseconds.
     * @param logger         logger of the connectors.
     */
    @Nonnull
    public static Factory factory(@Nonnull Vertx vertx, int requestTimeout, @Nonnull Logger logger) {
        return loginParam -> new OnvifDeviceConnector(vertx, loginParam, requestTimeout, logger);
    }

    public OnvifDeviceConnector(@Nonnull Vertx vertx,
                                @Nonnull LoginParam loginParam,
                                int requestTimeout,
                                @Nonnull Logger logger) {
        super(loginParam);
        this.requestTimeout = requestTimeout;
        this.logger = logger;
        this.deviceAddress = "http://" + loginParam.serverID + "/onvif/device_service";
        this.client = vertx.createHttpClient(new HttpClientOptions().setConnectTimeout(requestTimeout));
    }

    /**
     * Post a request body to a service and read the response.
     */
    private Future<SoapResponse> call(String address, String body) {
        final String envelope = SoapEnvelope.build(loginParam.username, loginParam.password, body);
        logger.debug("ONVIF request to " + address + ": " + body);
        return client.request(new RequestOptions()
                        .setMethod(HttpMethod.POST)
                        .setAbsoluteURI(address)
                        .setTimeout(requestTimeout))
                .compose(request -> request
                        .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE)
                        .send(envelope))
                .compose(response -> response.body()
                        .compose(buf -> read(response.statusCode(), buf.toString(StandardCharsets.UTF_8))));
    }

    private Future<SoapResponse> read(int statusCode, String text) {
        if (statusCode == 401) {
            return Future.failedFuture(new OnvifException(
                    "Authentication failed for " + loginParam, statusCode));
        }
        final SoapResponse response;
        try {
            response = SoapResponse.parse(text);
        } catch (OnvifException e) {
            return Future.failedFuture(new OnvifException(
                    e.getMessage() + " (HTTP " + statusCode + ")", statusCode));
        }
        if (statusCode >= 300) {
            return Future.failedFuture(new OnvifException(
                    "Unexpected HTTP status " + statusCode + " from " + loginParam.serverID, statusCode));
        }
        return Future.succeededFuture(response);
    }

    @Override
    public Future<DeviceInfo> init() {
        return call(deviceAddress, "<GetDeviceInformation xmlns=\"" + DEVICE_NS + "\"/>")
                .map(response -> DeviceInfo.fromProperties(response.childTexts("GetDeviceInformationResponse")))
                .compose(info -> call(deviceAddress,
                        "<GetCapabilities xmlns=\"" + DEVICE_NS + "\"><Category>All</Category></GetCapabilities>")
                        .compose(capabilities -> {
                            final String mediaAddress = capabilities.serviceAddress("Media");
                            final String ptz = capabilities.serviceAddress("PTZ");
                            if (mediaAddress == null || ptz == null) {
                                logger.debug("No PTZ service announced by " + loginParam.serverID);
                                return Future.succeededFuture(info);
                            }
                            return call(mediaAddress, "<GetProfiles xmlns=\"" + MEDIA_NS + "\"/>")
                                    .map(profiles -> {
                                        profileToken = profiles.firstProfileToken();
                                        if (profileToken != null) {
                                            ptzAddress = ptz;
                                        }
                                        return info;
                                    });
                        }));
    }

    @Override
    public boolean isPtzSupported() {
        return ptzAddress != null && profileToken != null;
    }

    private String profile() {
        return "<ProfileToken>" + escape(profileToken) + "</ProfileToken>";
    }

    private static String vector(Velocity velocity) {
        return "<PanTilt xmlns=\"" + SCHEMA_NS + "\" x=\"" + velocity.x + "\" y=\"" + velocity.y + "\"/>"
                + "<Zoom xmlns=\"" + SCHEMA_NS + "\" x=\"" + velocity.z + "\"/>";
    }

    private Future<Void> ptzCall(String body) {
        if (!isPtzSupported()) {
            return Future.failedFuture(new OnvifException("Device " + loginParam.serverID + " has no PTZ service"));
        }
        return call(ptzAddress, body).mapEmpty();
    }

    @Override
    public Future<List<Preset>> getPresets() {
        if (!isPtzSupported()) {
            return Future.failedFuture(new OnvifException("Device " + loginParam.serverID + " has no PTZ service"));
        }
        return call(ptzAddress, "<GetPresets xmlns=\"" + PTZ_NS + "\">" + profile() + "</GetPresets>")
                .map(SoapResponse::presets);
    }

    @Override
    public Future<Void> continuousMove(@Nonnull Velocity velocity, int timeoutSeconds) {
        return ptzCall("<ContinuousMove xmlns=\"" + PTZ_NS + "\">" + profile()
                + "<Velocity>" + vector(velocity) + "</Velocity>"
                + "<Timeout>PT" + timeoutSeconds + "S</Timeout>"
                + "</ContinuousMove>");
    }

    @Override
    public Future<Void> gotoPreset(@Nonnull String presetToken, @Nonnull Velocity speed) {
        return ptzCall("<GotoPreset xmlns=\"" + PTZ_NS + "\">" + profile()
                + "<PresetToken>" + escape(presetToken) + "</PresetToken>"
                + "<Speed>" + vector(speed) + "</Speed>"
                + "</GotoPreset>");
    }

    @Override
    public Future<Void> gotoHomePosition() {
        return ptzCall("<GotoHomePosition xmlns=\"" + PTZ_NS + "\">" + profile() + "</GotoHomePosition>");
    }

    @Override
    public Future<Void> stop() {
        return ptzCall("<Stop xmlns=\"" + PTZ_NS + "\">" + profile()
                + "<PanTilt>true</PanTilt><Zoom>true</Zoom></Stop>");
    }

    @Override
    public void close() {
        client.close();
    }
}
