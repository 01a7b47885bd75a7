package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.UnknownStructureException;
import org.dxworks.rfcmark.model.doc.DocNode;
import org.dxworks.rfcmark.model.doc.NodeKind;
import org.dxworks.rfcmark.model.xml.XmlElement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules for the bibliography in the back matter. Reference sections are numbered like
 * the main sections; each entry becomes a {@link NodeKind#REFERENCE} node whose label is
 * the one given by {@code <displayreference>}, or its anchor.
 */
class ReferenceRules {

    private final ModelBuilder builder;
    private final Map<String, String> displayLabels = new HashMap<>();
    private final Map<String, TagRule> sectionRules;

    ReferenceRules(ModelBuilder builder) {
        this.builder = builder;
        this.sectionRules = Map.of(
                "name", TagRule.skip(),
                "references", TagRule.block(this::references),
                "reference", TagRule.block(this::reference),
                "referencegroup", TagRule.block(this::referenceGroup));
    }

    Map<String, TagRule> backMatterRules() {
        return Map.of(
                "references", TagRule.block(this::references),
                "displayreference", TagRule.skip());
    }

    void collectDisplayLabels(XmlElement back) {
        for (XmlElement child : back.childElements()) {
            if ("displayreference".equals(child.getName())) {
                String target = child.getAttribute("target");
                String label = child.getAttribute("to");
                if (target != null && label != null && !label.isBlank()) {
                    displayLabels.put(target, label.trim());
                }
            } else {
                collectDisplayLabels(child);
            }
        }
    }

    private List<DocNode> references(XmlElement element) throws UnknownStructureException {
        DocNode section = builder.newSection(element);
        section.appendix = false;
        section.properties.put("references", "true");
        if (section.title == null) {
            section.title = "References";
            section.titleContent.add(DocNode.text("References"));
        }
        section.children = builder.sectionBody(element, sectionRules);
        return List.of(section);
    }

    private List<DocNode> reference(XmlElement element) throws UnknownStructureException {
        DocNode entry = referenceEntry(element);
        return entry == null ? List.of() : List.of(entry);
    }

    private List<DocNode> referenceGroup(XmlElement element) throws UnknownStructureException {
        DocNode group = labelled(element);
        if (group == null) {
            return List.of();
        }
        group.properties.put("group", "true");
        putIfPresent(group, "target", element.getAttribute("target"));
        for (XmlElement member : element.childElements()) {
            if ("reference".equals(member.getName())) {
                DocNode entry = referenceEntry(member);
                if (entry != null) {
                    group.children.add(entry);
                }
            } else {
                group.children.add(ModelBuilder.paragraphOf(builder.unknownInline(element, member)));
            }
        }
        return List.of(group);
    }

    private DocNode referenceEntry(XmlElement element) throws UnknownStructureException {
        DocNode entry = labelled(element);
        if (entry == null) {
            return null;
        }
        XmlElement front = element.firstChild("front");
        if (front != null) {
            putIfPresent(entry, "title", FrontMatterReader.textOf(front.firstChild("title")));
            putIfPresent(entry, "authors", formatAuthors(front.childElements("author")));
            putIfPresent(entry, "date", FrontMatterReader.formatDate(front.firstChild("date"), false));
        }

        List<String> series = new ArrayList<>();
        for (XmlElement info : seriesInfo(element, front)) {
            String name = info.getAttribute("name");
            String value = info.getAttribute("value");
            if (name != null && value != null) {
                series.add(name + " " + value);
            }
        }
        if (!series.isEmpty()) {
            entry.properties.put("series", String.join(", ", series));
        }

        List<String> refcontent = new ArrayList<>();
        for (XmlElement content : element.childElements("refcontent")) {
            String text = FrontMatterReader.textOf(content);
            if (text != null) {
                refcontent.add(text);
            }
        }
        if (!refcontent.isEmpty()) {
            entry.properties.put("refcontent", String.join(", ", refcontent));
        }
        putIfPresent(entry, "target", element.getAttribute("target"));
        return entry;
    }

    private DocNode labelled(XmlElement element) throws UnknownStructureException {
        String anchor = element.getAttribute("anchor");
        if (anchor == null) {
            builder.unknownAttribute(element, "anchor", "", "a bibliography entry needs an anchor");
            return null;
        }
        DocNode entry = builder.newNode(NodeKind.REFERENCE, element);
        entry.properties.put("label", displayLabels.getOrDefault(anchor, anchor));
        return entry;
    }

    // seriesInfo moved from <front> to <reference> in v3; both placements occur in published RFCs
    private static List<XmlElement> seriesInfo(XmlElement reference, XmlElement front) {
        List<XmlElement> infos = new ArrayList<>(reference.childElements("seriesInfo"));
        if (front != null) {
            infos.addAll(front.childElements("seriesInfo"));
        }
        return infos;
    }

    /** "A", "A and B", or "A, B, and C", each author as "Surname, I." or the organization. */
    static String formatAuthors(List<XmlElement> authors) {
        List<String> names = new ArrayList<>();
        for (XmlElement author : authors) {
            String name = authorName(author);
            if (name != null) {
                names.add("editor".equals(author.getAttribute("role")) ? name + ", Ed." : name);
            }
        }
        if (names.isEmpty()) {
            return null;
        }
        if (names.size() == 1) {
            return names.get(0);
        }
        if (names.size() == 2) {
            return names.get(0) + " and " + names.get(1);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + ", and " + names.get(names.size() - 1);
    }

    private static String authorName(XmlElement author) {
        String surname = author.getAttribute("surname");
        String initials = author.getAttribute("initials");
        if (surname != null && !surname.isBlank()) {
            return initials != null && !initials.isBlank() ? surname + ", " + initials : surname;
        }
        String fullname = author.getAttribute("fullname");
        if (fullname != null && !fullname.isBlank()) {
            return fullname;
        }
        return FrontMatterReader.textOf(author.firstChild("organization"));
    }

    private static void putIfPresent(DocNode node, String property, String value) {
        if (value != null && !value.isBlank()) {
            node.properties.put(property, value);
        }
    }
}
