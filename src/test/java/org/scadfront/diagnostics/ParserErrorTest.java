package org.scadfront.diagnostics;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParserErrorTest {

    @Test
    @Tag("unit")
    void formatsWithLocation() {
        ParserError error = new ParserError("Missing semicolon", ErrorCode.MISSING_SEMICOLON, Severity.ERROR,
                ErrorContext.builder().position(3, 7).build());

        assertThat(error.getFormattedMessage()).isEqualTo("ERROR [3:7] [E102]: Missing semicolon");
        assertThat(error.toString()).isEqualTo(error.getFormattedMessage());
    }

    @Test
    @Tag("unit")
    void formatsWithoutLocationWhenColumnIsUnknown() {
        ParserError error = new ParserError("Unknown", ErrorCode.SYNTAX_ERROR, Severity.WARNING,
                ErrorContext.builder().line(3).build());

        assertThat(error.getFormattedMessage()).isEqualTo("WARNING [E100]: Unknown");
    }

    @Test
    @Tag("unit")
    void recoverableAndFatalFollowSeverity() {
        assertThat(new ParserError("w", ErrorCode.SYNTAX_ERROR, Severity.WARNING, null).isRecoverable()).isTrue();
        assertThat(new ParserError("e", ErrorCode.SYNTAX_ERROR).isRecoverable()).isFalse();
        assertThat(new ParserError("e", ErrorCode.SYNTAX_ERROR).isFatal()).isFalse();
        assertThat(new ParserInternalError("boom").isFatal()).isTrue();
    }

    @Test
    @Tag("unit")
    void nullContextBecomesEmpty() {
        ParserError error = new ParserError("e", ErrorCode.SYNTAX_ERROR, Severity.ERROR, null);

        assertThat(error.getContext()).isNotNull();
        assertThat(error.getContext().hasPosition()).isFalse();
    }

    @Test
    @Tag("unit")
    void subtypesCarryTheirCodes() {
        assertThat(new ParserSyntaxError("s").getCode()).isEqualTo(ErrorCode.SYNTAX_ERROR);
        assertThat(new ParserTypeError("t").getCode()).isEqualTo(ErrorCode.TYPE_ERROR);
        assertThat(new ParserReferenceError("r").getCode()).isEqualTo(ErrorCode.REFERENCE_ERROR);
        assertThat(new ParserValidationError("v").getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);

        ParserInternalError internal = new ParserInternalError("i");
        assertThat(internal.getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(internal.getSeverity()).isEqualTo(Severity.FATAL);
        assertThat(internal.getContext().getHelpUrl()).isEqualTo(ParserInternalError.HELP_URL);
    }

    @Test
    @Tag("unit")
    void serializesToJson() {
        ParserError error = new ParserSyntaxError("Unexpected token", ErrorContext.builder()
                .position(2, 4)
                .expected(List.of(";"))
                .found("}")
                .build());

        JsonObject json = error.toJson();

        assertThat(json.get("name").getAsString()).isEqualTo("ParserSyntaxError");
        assertThat(json.get("message").getAsString()).isEqualTo("Unexpected token");
        assertThat(json.get("code").getAsString()).isEqualTo("E100");
        assertThat(json.get("severity").getAsString()).isEqualTo("ERROR");
        JsonObject context = json.getAsJsonObject("context");
        assertThat(context.get("line").getAsInt()).isEqualTo(2);
        assertThat(context.get("found").getAsString()).isEqualTo("}");
        assertThat(context.getAsJsonArray("expected").get(0).getAsString()).isEqualTo(";");
        assertThat(context.has("suggestion")).isFalse();
        assertThat(json.get("stack").getAsString()).contains("serializesToJson");
        assertThat(error.toJsonString()).contains("\"code\":\"E100\"");
    }

    @Test
    @Tag("unit")
    void codesMapToCategories() {
        assertThat(ErrorCode.MISSING_SEMICOLON.category()).isEqualTo(ErrorCategory.SYNTAX);
        assertThat(ErrorCode.INVALID_FUNCTION_CALL_ARGUMENT_TYPE.category()).isEqualTo(ErrorCategory.TYPE);
        assertThat(ErrorCode.UNDEFINED_MODULE.category()).isEqualTo(ErrorCategory.REFERENCE);
        assertThat(ErrorCode.INVALID_MODIFIER.category()).isEqualTo(ErrorCategory.VALIDATION);
        assertThat(ErrorCode.MISSING_LET_BODY.category()).isEqualTo(ErrorCategory.SEMANTIC);
        assertThat(ErrorCode.NOT_IMPLEMENTED.category()).isEqualTo(ErrorCategory.INTERNAL);
        assertThat(ErrorCode.fromCode("E301")).isEqualTo(ErrorCode.UNDEFINED_VARIABLE);
        assertThatThrownBy(() -> ErrorCode.fromCode("E999")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void contextCopyIsIndependent() {
        ErrorContext original = ErrorContext.builder().suggestions(List.of("a")).build();
        ErrorContext copy = original.copy();

        copy.getSuggestions().add("b");

        assertThat(original.getSuggestions()).containsExactly("a");
    }
}
