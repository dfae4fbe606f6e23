package dev.braceline.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VariablePreambleTest {

    @Test
    void rendersAssignmentsInInsertionOrder() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("name", "world");
        variables.put("count", "3");

        VariablePreamble preamble = new VariablePreamble(variables);

        assertThat(preamble.render()).isEqualTo("name = 'world'\ncount = '3'\n");
        assertThat(preamble.prependTo("print ( name )\n"))
                .isEqualTo("name = 'world'\ncount = '3'\nprint ( name )\n");
    }

    @Test
    void escapesValuesAsPythonLiterals() {
        assertThat(VariablePreamble.quote("it's a \\ path\n\tend\u0001"))
                .isEqualTo("'it\\'s a \\\\ path\\n\\tend\\x01'");
    }

    @Test
    void emptyBindingsLeaveProgramUntouched() {
        VariablePreamble preamble = new VariablePreamble(null);

        assertThat(preamble.isEmpty()).isTrue();
        assertThat(preamble.prependTo("pass\n")).isEqualTo("pass\n");
    }

    @Test
    void rejectsNamesThatAreNotIdentifiers() {
        Throwable thrown = catchThrowable(() -> new VariablePreamble(Map.of("1st", "x")));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1st");
    }

    @Test
    void rejectsKeywords() {
        Throwable thrown = catchThrowable(() -> new VariablePreamble(Map.of("lambda", "x")));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }
}
