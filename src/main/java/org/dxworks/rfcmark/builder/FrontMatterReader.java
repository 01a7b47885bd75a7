package org.dxworks.rfcmark.builder;

import org.dxworks.rfcmark.model.doc.AuthorInfo;
import org.dxworks.rfcmark.model.doc.FrontMatter;
import org.dxworks.rfcmark.model.xml.XmlElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads document metadata from the root attributes and the {@code <front>} element.
 */
public class FrontMatterReader {

    /** Children of {@code <front>} that end up in the front matter rather than the body. */
    static final Set<String> METADATA_TAGS = Set.of(
            "title", "seriesInfo", "author", "date", "area", "workgroup", "keyword");

    public FrontMatter read(XmlElement rfc, XmlElement front) {
        FrontMatter frontMatter = new FrontMatter();

        XmlElement title = front.firstChild("title");
        if (title != null) {
            frontMatter.title = ModelBuilder.plainText(title);
            frontMatter.abbrev = title.getAttribute("abbrev");
        }
        frontMatter.docname = rfc.getAttribute("docName");
        frontMatter.number = rfc.getAttribute("number");
        frontMatter.category = rfc.getAttribute("category");
        frontMatter.ipr = rfc.getAttribute("ipr");
        frontMatter.submissiontype = rfc.getAttribute("submissionType");
        frontMatter.consensus = rfc.getAttribute("consensus");
        frontMatter.date = formatDate(front.firstChild("date"), true);
        frontMatter.area = textOf(front.firstChild("area"));
        frontMatter.workgroup = textOf(front.firstChild("workgroup"));

        for (XmlElement keyword : front.childElements("keyword")) {
            String text = ModelBuilder.plainText(keyword);
            if (!text.isEmpty()) {
                frontMatter.keyword.add(text);
            }
        }
        for (XmlElement author : front.childElements("author")) {
            frontMatter.author.add(readAuthor(author));
        }
        return frontMatter;
    }

    public static AuthorInfo readAuthor(XmlElement author) {
        AuthorInfo info = new AuthorInfo();
        String initials = author.getAttribute("initials");
        String surname = author.getAttribute("surname");
        if (initials != null && surname != null) {
            info.ins = initials + " " + surname;
        }
        info.name = author.getAttribute("fullname");
        info.organization = textOf(author.firstChild("organization"));
        info.email = textOf(author.find("address/email"));
        info.uri = textOf(author.find("address/uri"));
        info.phone = textOf(author.find("address/phone"));

        XmlElement postal = author.find("address/postal");
        if (postal != null) {
            List<String> streets = new ArrayList<>();
            for (XmlElement street : postal.childElements("street")) {
                String text = ModelBuilder.plainText(street);
                if (!text.isEmpty()) {
                    streets.add(text);
                }
            }
            info.street = streets.isEmpty() ? null : String.join(", ", streets);
            info.city = textOf(postal.firstChild("city"));
            info.region = textOf(postal.firstChild("region"));
            info.code = textOf(postal.firstChild("code"));
            info.country = textOf(postal.firstChild("country"));
        }
        return info;
    }

    /**
     * "day month year" for the document itself, "month year" for bibliography entries.
     * Returns null when the element is absent or empty.
     */
    static String formatDate(XmlElement date, boolean withDay) {
        if (date == null) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        if (withDay && date.getAttribute("day") != null) {
            parts.add(date.getAttribute("day"));
        }
        if (date.getAttribute("month") != null) {
            parts.add(date.getAttribute("month"));
        }
        if (date.getAttribute("year") != null) {
            parts.add(date.getAttribute("year"));
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    static String textOf(XmlElement element) {
        if (element == null) {
            return null;
        }
        String text = ModelBuilder.plainText(element);
        return text.isEmpty() ? null : text;
    }
}
