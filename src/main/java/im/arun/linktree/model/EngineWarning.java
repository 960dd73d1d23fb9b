package im.arun.linktree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Non-fatal condition found while parsing, loading or binding.
 * Returned alongside results so callers can log or display it.
 */
@Value
public class EngineWarning {

    @JsonProperty("type")
    WarningType type;

    /** Line reference, node id or record code the warning is about. */
    @JsonProperty("subject")
    String subject;

    @JsonProperty("message")
    String message;

    public static EngineWarning of(WarningType type, String subject, String format, Object... args) {
        return new EngineWarning(type, subject, String.format(format, args));
    }
}
