package org.dxworks.rfcmark.model.doc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Document metadata from the root attributes and the {@code <front>} element,
 * serialized as the YAML front matter block.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"title", "abbrev", "docname", "number", "category", "ipr", "submissiontype",
        "consensus", "date", "area", "workgroup", "keyword", "author"})
public class FrontMatter {
    public String title;
    public String abbrev;
    public String docname;
    public String number;
    public String category;
    public String ipr;
    public String submissiontype;
    public String consensus;
    public String date;
    public String area;
    public String workgroup;
    public List<String> keyword = new ArrayList<>();
    public List<AuthorInfo> author = new ArrayList<>();
}
