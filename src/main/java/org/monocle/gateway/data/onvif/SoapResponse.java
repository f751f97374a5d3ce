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

import org.monocle.gateway.entities.Preset;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The SoapResponse class helps reading ONVIF responses. Elements are looked up
 * by local name in any namespace, since cameras disagree on prefixes.
 */
public class SoapResponse {

    private final Document doc;

    private SoapResponse(Document doc) {
        this.doc = doc;
    }

    /**
     * Parse a SOAP response.
     *
     * @param xml raw response text.
     * @return the parsed response.
     * @throws OnvifException if the text is not XML, or carries a SOAP fault.
     */
    @Nonnull
    public static SoapResponse parse(@Nonnull String xml) throws OnvifException {
        final Document doc;
        try {
            DocumentBuilderFactory documentBuilderFactory = DocumentBuilderFactory.newInstance();
            documentBuilderFactory.setNamespaceAware(true);
            documentBuilderFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder documentBuilder = documentBuilderFactory.newDocumentBuilder();
            doc = documentBuilder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new OnvifException("Malformed SOAP response: " + e.getMessage(), e);
        }

        final SoapResponse response = new SoapResponse(doc);
        final Element fault = response.first("Fault");
        if (fault != null) {
            final Element reason = response.first(fault, "Text");
            throw new OnvifException("SOAP fault: "
                    + (reason != null ? reason.getTextContent().trim() : fault.getTextContent().trim()));
        }
        return response;
    }

    /**
     * @return the first element of the given local name in the document, or null.
     */
    @Nullable
    public Element first(@Nonnull String localName) {
        return first(doc.getDocumentElement(), localName);
    }

    @Nullable
    public Element first(@Nonnull Element parent, @Nonnull String localName) {
        final NodeList nodeList = parent.getElementsByTagNameNS("*", localName);
        return nodeList.getLength() > 0 ? (Element) nodeList.item(0) : null;
    }

    /**
     * @return all elements of the given local name in the document, in document order.
     */
    @Nonnull
    public List<Element> all(@Nonnull String localName) {
        final NodeList nodeList = doc.getDocumentElement().getElementsByTagNameNS("*", localName);
        final List<Element> elements = new ArrayList<>(nodeList.getLength());
        for (int i = 0; i < nodeList.getLength(); ++i) {
            elements.add((Element) nodeList.item(i));
        }
        return elements;
    }

    /**
     * Text of the first element of the given local name, or null if absent.
     */
    @Nullable
    public String text(@Nonnull String localName) {
        final Element element = first(localName);
        return element == null ? null : element.getTextContent().trim();
    }

    /**
     * Collect the text of the direct child elements of the first element of
     * the given local name, keyed by their local name.
     */
    @Nonnull
    public Map<String, String> childTexts(@Nonnull String localName) {
        final Map<String, String> props = new HashMap<>();
        final Element parent = first(localName);
        if (parent == null) {
            return props;
        }
        final NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); ++i) {
            final Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                props.put(child.getLocalName(), child.getTextContent().trim());
            }
        }
        return props;
    }

    /**
     * Service address announced under a capability element, such as "PTZ" or "Media".
     */
    @Nullable
    public String serviceAddress(@Nonnull String capability) {
        for (Element element : all(capability)) {
            final Element xaddr = first(element, "XAddr");
            if (xaddr != null && !xaddr.getTextContent().trim().isEmpty()) {
                return xaddr.getTextContent().trim();
            }
        }
        return null;
    }

    /**
     * @return the token of the first media profile, or null if there is none.
     */
    @Nullable
    public String firstProfileToken() {
        for (Element profile : all("Profiles")) {
            final String token = profile.getAttribute("token");
            if (!token.isEmpty()) {
                return token;
            }
        }
        return null;
    }

    /**
     * Read the presets of a GetPresets response. Responses listing a single
     * preset are read the same way as those listing many.
     */
    @Nonnull
    public List<Preset> presets() {
        final List<Preset> presets = new ArrayList<>();
        for (Element element : all("Preset")) {
            final String token = element.getAttribute("token");
            if (token.isEmpty()) {
                continue;
            }
            final Element name = first(element, "Name");
            presets.add(new Preset(token, name == null ? null : name.getTextContent().trim()));
        }
        return presets;
    }
}
