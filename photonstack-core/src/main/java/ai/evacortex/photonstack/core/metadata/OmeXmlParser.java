/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.metadata;

import ai.evacortex.photonstack.core.SampleType;
import ai.evacortex.photonstack.core.exceptions.InvalidDescriptorException;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteOrder;

/**
 * Extracts the {@code Pixels} element of an OME-XML document. DOCTYPEs and external entities
 * are refused.
 */
public final class OmeXmlParser {

    private OmeXmlParser() {}

    public static PixelsDescriptor parse(String document) {
        Element pixels = pixelsElement(document);
        int sizeX = positive(pixels, "SizeX", null);
        int sizeY = positive(pixels, "SizeY", null);
        int sizeT = positive(pixels, "SizeT", 1);
        int sizeZ = positive(pixels, "SizeZ", 1);
        int sizeC = positive(pixels, "SizeC", 1);

        String type = pixels.getAttribute("Type");
        if (type.isEmpty()) throw new InvalidDescriptorException("Pixels element has no Type attribute");
        SampleType sampleType;
        try {
            sampleType = SampleType.fromName(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidDescriptorException(e.getMessage(), e);
        }

        ByteOrder order = Boolean.parseBoolean(pixels.getAttribute("BigEndian"))
                ? ByteOrder.BIG_ENDIAN
                : ByteOrder.LITTLE_ENDIAN;
        return new PixelsDescriptor(sizeT, sizeZ, sizeY, sizeX, sizeC, sampleType, order);
    }

    private static Element pixelsElement(String document) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            NodeList nodes = builder.parse(new InputSource(new StringReader(document.strip())))
                    .getElementsByTagNameNS("*", "Pixels");
            if (nodes.getLength() == 0) throw new InvalidDescriptorException("no Pixels element");
            return (Element) nodes.item(0);
        } catch (SAXException | IOException e) {
            throw new InvalidDescriptorException("malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }

    private static int positive(Element pixels, String attribute, Integer fallback) {
        String raw = pixels.getAttribute(attribute);
        if (raw.isEmpty()) {
            if (fallback != null) return fallback;
            throw new InvalidDescriptorException("Pixels element has no " + attribute + " attribute");
        }
        try {
            int value = Integer.parseInt(raw.strip());
            if (value <= 0) throw new InvalidDescriptorException(attribute + " must be positive, was " + value);
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidDescriptorException(attribute + " is not an integer: '" + raw + "'", e);
        }
    }
}
