package com.purchasingpower.coderag.session;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contents of a session's context file: the analysed repository, the global
 * context callers computed for it (file tree, summary) and generated reports.
 *
 * <p>{@code report} and {@code report_language} are the single-report layout of
 * older files; they are still written so older readers keep working. Unknown keys
 * are carried through a read-modify-write unchanged.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionContext {

    @JsonProperty("repo_url")
    private String repoUrl;

    @JsonProperty("global_context")
    private Map<String, Object> globalContext = new LinkedHashMap<>();

    @JsonProperty("reports")
    private Map<String, String> reports = new LinkedHashMap<>();

    @JsonProperty("report")
    private String report;

    @JsonProperty("report_language")
    private String reportLanguage;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    @JsonAnySetter
    public void setOther(String key, Object value) {
        other.put(key, value);
    }
}
