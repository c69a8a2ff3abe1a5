package com.logixtag.l5x;

import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.catalog.TypeDefinition;
import com.logixtag.catalog.Usage;
import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads data type and Add-On Instruction definitions from an L5X document.
 * Only metadata is read; tag data and logic are ignored.
 */
@UtilityClass
public class L5xTypeReader {
    private static final Logger log = LoggerFactory.getLogger(L5xTypeReader.class);

    public static L5xDocument read(InputStream in) throws TagCodecException {
        Document doc;
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder().parse(in);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new TagCodecException(ErrorType.MALFORMED_DOCUMENT, "Cannot parse L5X document: " + e.getMessage(), e);
        }
        doc.getDocumentElement().normalize();

        var dataTypes = new LinkedHashMap<String, TypeDefinition>();
        for (var dataType : elements(doc.getDocumentElement(), "DataType")) {
            var name = requiredAttribute(dataType, "Name");
            var members = new ArrayList<FieldDescriptor>();
            for (var member : childElements(dataType, "Members", "Member")) {
                members.add(descriptor(member, Usage.MEMBER));
            }
            dataTypes.put(name, TypeDefinition.composite(name, members));
        }

        var instructions = new LinkedHashMap<String, TypeDefinition>();
        for (var aoi : elements(doc.getDocumentElement(), "AddOnInstructionDefinition")) {
            var name = requiredAttribute(aoi, "Name");
            var members = new ArrayList<FieldDescriptor>();
            for (var parameter : childElements(aoi, "Parameters", "Parameter")) {
                Usage usage;
                try {
                    usage = Usage.fromAttribute(parameter.getAttribute("Usage"));
                } catch (IllegalArgumentException e) {
                    throw new TagCodecException(ErrorType.MALFORMED_DOCUMENT, parameter.getAttribute("Name"),
                            "Parameter '" + parameter.getAttribute("Name") + "' of '" + name + "': " + e.getMessage());
                }
                members.add(descriptor(parameter, usage));
            }
            for (var localTag : childElements(aoi, "LocalTags", "LocalTag")) {
                members.add(descriptor(localTag, Usage.LOCAL));
            }
            instructions.put(name, TypeDefinition.composite(name, members));
        }

        log.info("Read {} data types and {} Add-On Instructions", dataTypes.size(), instructions.size());
        return new L5xDocument(dataTypes, instructions);
    }

    private static FieldDescriptor descriptor(Element element, Usage usage) throws TagCodecException {
        var name = requiredAttribute(element, "Name");
        // members declare "Dimension", parameters and local tags "Dimensions"
        var dimension = element.hasAttribute("Dimension")
                ? element.getAttribute("Dimension")
                : element.getAttribute("Dimensions");
        return FieldDescriptor.builder()
                .name(name)
                .typeName(requiredAttribute(element, "DataType"))
                .arrayLength(FieldDescriptor.parseDimension(name, dimension))
                .hidden(Boolean.parseBoolean(element.getAttribute("Hidden")))
                .required(Boolean.parseBoolean(element.getAttribute("Required")))
                .visible(!element.hasAttribute("Visible") || Boolean.parseBoolean(element.getAttribute("Visible")))
                .usage(usage)
                .build();
    }

    private static String requiredAttribute(Element element, String attribute) throws TagCodecException {
        if (!element.hasAttribute(attribute)) {
            throw new TagCodecException(ErrorType.MALFORMED_DOCUMENT, element.getTagName(),
                    "<" + element.getTagName() + "> is missing the " + attribute + " attribute");
        }
        return element.getAttribute(attribute);
    }

    private static List<Element> elements(Element root, String tagName) {
        var nodes = root.getElementsByTagName(tagName);
        var result = new ArrayList<Element>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Elements named {@code childName} directly under the {@code containerName} child of {@code parent}.
     */
    private static List<Element> childElements(Element parent, String containerName, String childName) {
        var result = new ArrayList<Element>();
        for (var container = parent.getFirstChild(); container != null; container = container.getNextSibling()) {
            if (!isElement(container, containerName)) continue;
            for (var child = container.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (isElement(child, childName)) result.add((Element) child);
            }
        }
        return result;
    }

    private static boolean isElement(Node node, String name) {
        return node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName());
    }
}
