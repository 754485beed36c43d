package org.dxworks.alhconverter.export;

import org.dxworks.alhconverter.model.AlarmChannel;
import org.dxworks.alhconverter.model.AlarmNode;
import org.dxworks.alhconverter.model.AlarmTree;
import org.dxworks.alhconverter.model.AutomatedAction;
import org.dxworks.alhconverter.model.Command;
import org.dxworks.alhconverter.model.Display;
import org.dxworks.alhconverter.model.Guidance;
import org.dxworks.alhconverter.model.InclusionMarker;
import org.dxworks.alhconverter.model.TreeNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;

/**
 * Writes the Phoebus alarm configuration XML.
 *
 * <p>The root becomes the {@code config} element named after the configuration; only its
 * children are exported. Groups are {@code component}s, channels {@code pv}s and inclusion
 * markers {@code xi:include}s pointing at the first element of the included file.
 */
public class XmlTreeWriter implements TreeWriter {

    public static final String EXTENSION = ".xml";
    static final String XINCLUDE_NAMESPACE = "http://www.w3.org/2001/XInclude";
    static final String XPOINTER = "element(/1/1)";

    private final int indent;

    public XmlTreeWriter() {
        this(2);
    }

    public XmlTreeWriter(int indent) {
        this.indent = indent > 0 ? indent : 2;
    }

    @Override
    public String extension() {
        return EXTENSION;
    }

    @Override
    public String render(AlarmTree tree) {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);

            Element config = doc.createElement("config");
            config.setAttribute("name", tree.getConfigName());
            doc.appendChild(config);
            appendChildren(doc, config, tree, tree.getRootId());

            return serialize(doc);
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("Failed to write XML for config " + tree.getConfigName(), e);
        }
    }

    private void appendChildren(Document doc, Element parent, AlarmTree tree, String id) {
        for (TreeNode child : tree.children(id)) {
            Element element = toElement(doc, child);
            parent.appendChild(element);
            appendChildren(doc, element, tree, child.getIdentifier());
        }
    }

    private Element toElement(Document doc, TreeNode node) {
        if (node instanceof InclusionMarker marker) {
            Element include = doc.createElement("xi:include");
            include.setAttribute("href", marker.linkTarget(EXTENSION));
            include.setAttribute("xpointer", XPOINTER);
            include.setAttribute("xmlns:xi", XINCLUDE_NAMESPACE);
            return include;
        }
        if (node instanceof AlarmChannel channel) {
            Element pv = doc.createElement("pv");
            pv.setAttribute("name", channel.getPvName());
            appendChannelSettings(doc, pv, channel);
            appendEntries(doc, pv, channel);
            return pv;
        }
        if (node instanceof AlarmNode group) {
            Element component = doc.createElement("component");
            component.setAttribute("name", group.getName());
            appendEntries(doc, component, group);
            return component;
        }
        throw new IllegalArgumentException("Can't export " + node + " below the root");
    }

    private void appendChannelSettings(Document doc, Element pv, AlarmChannel channel) {
        if (!channel.getDescription().isEmpty()) {
            appendText(doc, pv, "description", channel.getDescription());
        }
        appendText(doc, pv, "enabled", String.valueOf(channel.isEnabled()));
        appendText(doc, pv, "latching", String.valueOf(channel.isLatching()));
        appendText(doc, pv, "annunciating", String.valueOf(channel.isAnnunciating()));
        if (channel.getDelay() != 0) {
            appendText(doc, pv, "delay", String.valueOf(channel.getDelay()));
            if (channel.getCount() != 0) {
                appendText(doc, pv, "count", String.valueOf(channel.getCount()));
            }
        }
        String filter = channel.targetFilter();
        if (filter != null) {
            appendText(doc, pv, "filter", filter);
        }
    }

    private void appendEntries(Document doc, Element parent, AlarmNode node) {
        for (Guidance guidance : node.getGuidances()) {
            Element element = appendElement(doc, parent, "guidance");
            appendText(doc, element, "title", guidance.title);
            appendText(doc, element, "details", guidance.details);
        }
        for (Display display : node.getDisplays()) {
            Element element = appendElement(doc, parent, "display");
            appendText(doc, element, "title", display.title);
            appendText(doc, element, "details", display.details);
        }
        for (Command command : node.getCommands()) {
            Element element = appendElement(doc, parent, "command");
            appendText(doc, element, "title", command.title);
            appendText(doc, element, "details", command.details);
        }
        for (AutomatedAction action : node.getActions()) {
            Element element = appendElement(doc, parent, "automated_action");
            appendText(doc, element, "title", action.title);
            appendText(doc, element, "details", action.details);
            appendText(doc, element, "delay", String.valueOf(action.delay));
        }
    }

    private static Element appendElement(Document doc, Element parent, String name) {
        Element element = doc.createElement(name);
        parent.appendChild(element);
        return element;
    }

    private static void appendText(Document doc, Element parent, String name, String text) {
        appendElement(doc, parent, name).setTextContent(text);
    }

    private String serialize(Document doc) throws TransformerException {
        Transformer transformer = TransformerFactory.newInstance().newTransformer();
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", String.valueOf(indent));

        StringWriter out = new StringWriter();
        transformer.transform(new DOMSource(doc), new StreamResult(out));
        return out.toString();
    }
}
