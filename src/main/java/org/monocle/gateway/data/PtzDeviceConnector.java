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

package org.monocle.gateway.data;

import io.vertx.core.Future;
import org.monocle.gateway.common.LoginParam;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * The PtzDeviceConnector is the base class for all PTZ device connector
 * classes. It speaks the device protocol on behalf of a camera session and is
 * not responsible for any state beyond the connection itself.
 * <p>
 * All operations are asynchronous. The PTZ operations are only meaningful
 * after {@link #init()} succeeded and {@link #isPtzSupported()} is true.
 */
public abstract class PtzDeviceConnector {

    /**
     * Produces a connector for a given camera login.
     */
    public interface Factory {
        /**
         * Produce a new connector.
         *
         * @param loginParam address and credentials of the camera.
         * @return A connector newly produced, not yet initialized.
         * @throws Exception On failure creating a new instance.
         */
        @Nonnull
        PtzDeviceConnector produce(@Nonnull LoginParam loginParam) throws Exception;
    }

    protected final LoginParam loginParam;

    /**
     * Create a PTZ device connector.
     *
     * @param loginParam Parameters for login.
     */
    public PtzDeviceConnector(@Nonnull LoginParam loginParam) {
        this.loginParam = loginParam;
    }

    @Nonnull
    public LoginParam getLoginParam() {
        return loginParam;
    }

    /**
     * Connect to the device and interrogate it.
     *
     * @return Future of the information reported by the device.
     */
    public abstract Future<DeviceInfo> init();

    /**
     * @return whether the device exposes a PTZ service. Only valid after init.
     */
    public abstract boolean isPtzSupported();

    /**
     * @return Future of the presets stored on the device, in device order.
     */
    public abstract Future<List<Preset>> getPresets();

    /**
     * Start moving the camera. The device stops the movement by itself when no
     * new command arrives within the timeout.
     *
     * @param velocity       speed of each axis.
     * @param timeoutSeconds idle timeout of the movement.
     */
    public abstract Future<Void> continuousMove(@Nonnull Velocity velocity, int timeoutSeconds);

    public abstract Future<Void> gotoPreset(@Nonnull String presetToken, @Nonnull Velocity speed);

    public abstract Future<Void> gotoHomePosition();

    public abstract Future<Void> stop();

    /**
     * Release the connection. Pending operations may still complete.
     */
    public void close() {
    }
}
