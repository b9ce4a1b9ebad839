package com.acme.grc.rollup;

import com.acme.grc.hierarchy.AliasAssigner;
import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.model.Enums.ComplianceState;
import com.acme.grc.model.RollupResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.acme.grc.model.Enums.ComplianceState.*;
import static org.assertj.core.api.Assertions.assertThat;

class ComplianceRollupTest {

    /** 1 (1.1, 1.2 (1.2.1, 1.2.2)), 2 */
    private static final Assessment TREE = new Assessment("Policy", null, "General Governance", AliasAssigner.assign(List.of(
            Control.group("Parent", null, List.of(
                    Control.leaf("A", null),
                    Control.group("Nested", null, List.of(Control.leaf("B", null), Control.leaf("C", null))))),
            Control.leaf("D", null))));

    private static Map<String, ComplianceState> allCompliant() {
        return Map.of("1.1", COMPLIANT, "1.2.1", COMPLIANT, "1.2.2", COMPLIANT, "2", COMPLIANT);
    }

    @Nested
    @DisplayName("Folding")
    class Folding {

        @Test
        @DisplayName("all compliant leaves make every ancestor compliant")
        void allCompliantTree() {
            RollupResult r = ComplianceRollup.evaluate(TREE, allCompliant());

            assertThat(r.overall()).isEqualTo(COMPLIANT);
            assertThat(r.states()).containsOnlyKeys("1", "1.1", "1.2", "1.2.1", "1.2.2", "2");
            assertThat(r.states().values()).containsOnly(COMPLIANT);
        }

        @Test
        @DisplayName("one non-compliant leaf flips every ancestor")
        void flipPropagates() {
            Map<String, ComplianceState> leaves = new HashMap<>(allCompliant());
            leaves.put("1.2.2", NON_COMPLIANT);

            RollupResult r = ComplianceRollup.evaluate(TREE, leaves);

            assertThat(r.stateOf("1.2")).isEqualTo(NON_COMPLIANT);
            assertThat(r.stateOf("1")).isEqualTo(NON_COMPLIANT);
            assertThat(r.stateOf("2")).isEqualTo(COMPLIANT);
            assertThat(r.overall()).isEqualTo(NON_COMPLIANT);
        }

        @Test
        @DisplayName("missing leaves are unevaluated and keep parents from being compliant")
        void missingLeaves() {
            RollupResult r = ComplianceRollup.evaluate(TREE, Map.of("1.1", COMPLIANT, "2", COMPLIANT));

            assertThat(r.stateOf("1.2.1")).isEqualTo(UNEVALUATED);
            assertThat(r.stateOf("1")).isEqualTo(UNEVALUATED);
            assertThat(r.overall()).isEqualTo(UNEVALUATED);
        }

        @Test
        @DisplayName("states are listed depth-first")
        void preOrder() {
            RollupResult r = ComplianceRollup.evaluate(TREE, Map.of());

            assertThat(r.states().keySet()).containsExactly("1", "1.1", "1.2", "1.2.1", "1.2.2", "2");
        }

        @Test
        @DisplayName("evaluation is idempotent")
        void idempotent() {
            Map<String, ComplianceState> leaves = Map.of("1.1", NON_COMPLIANT, "2", COMPLIANT);

            assertThat(ComplianceRollup.evaluate(TREE, leaves)).isEqualTo(ComplianceRollup.evaluate(TREE, leaves));
        }
    }

    @ParameterizedTest
    @CsvSource({
            "COMPLIANT, COMPLIANT",
            "pass, COMPLIANT",
            "Non-Compliant, NON_COMPLIANT",
            "non compliant, NON_COMPLIANT",
            "FAILED, NON_COMPLIANT",
            "maybe, UNEVALUATED",
            "'', UNEVALUATED"
    })
    @DisplayName("status strings map onto compliance states")
    void parseStatus(String status, ComplianceState expected) {
        assertThat(ComplianceRollup.parseStatus(status)).isEqualTo(expected);
    }
}
