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

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;

/**
 * Builds SOAP 1.2 envelopes for ONVIF requests. When credentials are given,
 * the header carries a WS-Security UsernameToken with a password digest.
 */
public final class SoapEnvelope {

    public static final String SOAP_NS = "http://www.w3.org/2003/05/soap-envelope";
    public static final String DEVICE_NS = "http://www.onvif.org/ver10/device/wsdl";
    public static final String MEDIA_NS = "http://www.onvif.org/ver10/media/wsdl";
    public static final String PTZ_NS = "http://www.onvif.org/ver20/ptz/wsdl";
    public static final String SCHEMA_NS = "http://www.onvif.org/ver10/schema";

    private static final String WSSE_NS =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-secext-1.0.xsd";
    private static final String WSU_NS =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-wssecurity-utility-1.0.xsd";
    private static final String PASSWORD_DIGEST_TYPE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-username-token-profile-1.0#PasswordDigest";
    private static final String BASE64_ENCODING_TYPE =
            "http://docs.oasis-open.org/wss/2004/01/oasis-200401-wss-soap-message-security-1.0#Base64Binary";

    private static final SecureRandom RANDOM = new SecureRandom();

    private SoapEnvelope() {
    }

    /**
     * Wrap a request body into an envelope, with a fresh nonce and timestamp.
     */
    @Nonnull
    public static String build(@Nullable String username, @Nullable String password, @Nonnull String body) {
        final byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        final String created = Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
        return build(username, password, body, nonce, created);
    }

    @Nonnull
    static String build(@Nullable String username,
                        @Nullable String password,
                        @Nonnull String body,
                        @Nonnull byte[] nonce,
                        @Nonnull String created) {
        final StringBuilder sb = new StringBuilder()
                .append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>")
                .append("<s:Envelope xmlns:s=\"").append(SOAP_NS).append("\">");
        if (StringUtils.isNotEmpty(username)) {
            sb.append("<s:Header>")
                    .append("<Security s:mustUnderstand=\"1\" xmlns=\"").append(WSSE_NS).append("\">")
                    .append("<UsernameToken>")
                    .append("<Username>").append(escape(username)).append("</Username>")
                    .append("<Password Type=\"").append(PASSWORD_DIGEST_TYPE).append("\">")
                    .append(passwordDigest(nonce, created, password == null ? "" : password))
                    .append("</Password>")
                    .append("<Nonce EncodingType=\"").append(BASE64_ENCODING_TYPE).append("\">")
                    .append(Base64.getEncoder().encodeToString(nonce))
                    .append("</Nonce>")
                    .append("<Created xmlns=\"").append(WSU_NS).append("\">").append(created).append("</Created>")
                    .append("</UsernameToken></Security></s:Header>");
        }
        return sb.append("<s:Body>").append(body).append("</s:Body></s:Envelope>").toString();
    }

    /**
     * Digest = Base64(SHA-1(nonce + created + password)).
     */
    @Nonnull
    public static String passwordDigest(@Nonnull byte[] nonce, @Nonnull String created, @Nonnull String password) {
        try {
            final MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(nonce);
            md.update(created.getBytes(StandardCharsets.UTF_8));
            md.update(password.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(md.digest());
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1.
            throw new IllegalStateException(e);
        }
    }

    /**
     * Escape a value for use as XML text or attribute content.
     */
    @Nonnull
    public static String escape(@Nonnull String value) {
        return StringUtils.replaceEach(value,
                new String[]{"&", "<", ">", "\"", "'"},
                new String[]{"&amp;", "&lt;", "&gt;", "&quot;", "&apos;"});
    }
}
