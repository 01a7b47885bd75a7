package org.dxworks.rfcmark.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened to one document of a batch; one line of the JSON Lines report.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"kind", "rfc", "output", "warnings", "error"})
public class DocumentOutcome {
    public static final String CONVERTED = "converted";
    public static final String FAILED = "failed";

    public String kind;
    public int rfc;
    public String output;
    public List<String> warnings = new ArrayList<>();
    public String error;

    public static DocumentOutcome converted(int rfc, String output, List<String> warnings) {
        DocumentOutcome outcome = new DocumentOutcome();
        outcome.kind = CONVERTED;
        outcome.rfc = rfc;
        outcome.output = output;
        outcome.warnings.addAll(warnings);
        return outcome;
    }

    public static DocumentOutcome failed(int rfc, String error) {
        DocumentOutcome outcome = new DocumentOutcome();
        outcome.kind = FAILED;
        outcome.rfc = rfc;
        outcome.error = error;
        return outcome;
    }

    @JsonIgnore
    public boolean isConverted() {
        return CONVERTED.equals(kind);
    }
}
