package vn.com.fecredit.filestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON body of every non-2xx response.
 *
 * <p>
 * {@code code} is a stable machine-readable error name such as
 * {@code SessionNotFound} or {@code IncompleteUpload}. The index lists are only
 * present for incomplete uploads so the client can resume precisely. They
 * are truncated for very large uploads; {@code missingCount} is then the
 * exact number of missing chunks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String code;
    private String message;
    private List<Integer> missingIndices;
    private Integer missingCount;
    private List<Integer> unexpectedIndices;

    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public List<Integer> getMissingIndices() { return missingIndices; }
    public void setMissingIndices(List<Integer> missingIndices) { this.missingIndices = missingIndices; }
    public Integer getMissingCount() { return missingCount; }
    public void setMissingCount(Integer missingCount) { this.missingCount = missingCount; }
    public List<Integer> getUnexpectedIndices() { return unexpectedIndices; }
    public void setUnexpectedIndices(List<Integer> unexpectedIndices) { this.unexpectedIndices = unexpectedIndices; }
}
