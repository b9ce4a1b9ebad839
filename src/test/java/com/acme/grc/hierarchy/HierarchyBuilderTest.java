package com.acme.grc.hierarchy;

import com.acme.grc.extract.RequirementExtractor;
import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;
import com.acme.grc.model.Requirement;
import com.acme.grc.model.ThemeHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyBuilderTest {

    private final RequirementExtractor extractor = new RequirementExtractor();
    private final HierarchyBuilder builder = new HierarchyBuilder();

    private Assessment compile(String name, String text, List<ThemeHint> hints) throws Exception {
        return builder.build(name, null, null, extractor.extract(text), hints);
    }

    private Assessment mfa() throws Exception {
        return compile("Remote Access Policy",
                "The organization must enforce MFA for all remote access and administrative accounts.", List.of());
    }

    @Nested
    @DisplayName("MFA policy sentence")
    class MfaScenario {

        @Test
        @DisplayName("should build one non-leaf parent with two leaves")
        void parentWithTwoLeaves() throws Exception {
            Assessment a = mfa();

            assertThat(a.categoryName()).isEqualTo("Access Management");
            assertThat(a.planControls()).hasSize(1);

            Control root = a.planControls().get(0);
            assertThat(root.alias()).isEqualTo("1");
            assertThat(root.displayable()).isEqualTo("1");
            assertThat(root.name()).isEqualTo("MFA Enforcement");
            assertThat(root.isLeaf()).isFalse();
            assertThat(root.planControls()).extracting(Control::alias).containsExactly("1.1", "1.2");
            assertThat(root.planControls()).extracting(Control::name).containsExactly("Remote Access", "Administrative Accounts");
            assertThat(root.planControls()).allMatch(Control::isLeaf);
            assertThat(root.planControls().get(1).description())
                    .isEqualTo("The organization must enforce MFA for all administrative accounts.");
        }

        @Test
        @DisplayName("category should never equal the assessment name")
        void categoryIsNotAssessmentName() throws Exception {
            Assessment a = compile("Access Management",
                    "The organization must enforce MFA for all remote access and administrative accounts.", List.of());

            assertThat(a.categoryName()).isEqualTo("General Governance");
        }

        @Test
        @DisplayName("explicit category should win over classification")
        void explicitCategory() throws Exception {
            List<Requirement> reqs = extractor.extract("The organization must enforce MFA for all remote access.");
            Assessment a = builder.build("Policy", "desc", "Identity", reqs, List.of());

            assertThat(a.categoryName()).isEqualTo("Identity");
            assertThat(a.description()).isEqualTo("desc");
        }
    }

    @Nested
    @DisplayName("Grouping")
    class Grouping {

        @Test
        @DisplayName("should group by the first matching theme hint in hint order")
        void themeHints() throws Exception {
            Assessment a = compile("Security Policy",
                    "Administrators must review access rights quarterly. All laptops must encrypt data at rest. "
                            + "Access logs shall be retained for one year.",
                    List.of(new ThemeHint("Access Review", List.of("access")),
                            new ThemeHint("Encryption", List.of("encrypt", "access"))));

            assertThat(a.planControls()).extracting(Control::name).containsExactly("Access Review", "Encryption");
            Control review = a.planControls().get(0);
            assertThat(review.planControls()).extracting(Control::alias).containsExactly("1.1", "1.2");
            assertThat(review.planControls()).extracting(Control::name)
                    .containsExactly("Access Rights Review", "Access Logs Retention");
            assertThat(a.planControls().get(1).planControls()).extracting(Control::name).containsExactly("Data Encryption");
        }

        @Test
        @DisplayName("a lone unsplit requirement should become a top-level leaf")
        void loneRequirementIsLeaf() throws Exception {
            Assessment a = compile("Accounts", "Shared accounts shall be disabled. "
                    + "The organization must enforce MFA for all remote access and administrative accounts.", List.of());

            assertThat(a.planControls()).extracting(Control::alias).containsExactly("1", "2");
            assertThat(a.planControls().get(0).isLeaf()).isTrue();
            assertThat(a.planControls().get(0).name()).isEqualTo("Shared Accounts Disablement");
            assertThat(a.planControls().get(1).planControls()).hasSize(2);
        }

        @Test
        @DisplayName("every alias should extend its parent and siblings should be unique")
        void aliasInvariants() throws Exception {
            Assessment a = compile("Ops", """
                    - Users must change passwords annually and must not share credentials
                    - Backups shall be tested for all databases, file servers and mail servers
                    - Vendors must sign an NDA
                    """, List.of());

            for (Control c : a.flatten()) {
                assertThat(c.isLeaf()).isEqualTo(c.planControls().isEmpty());
                for (Control child : c.planControls()) assertThat(child.alias()).startsWith(c.alias() + ".");
                assertThat(c.planControls()).extracting(Control::alias).doesNotHaveDuplicates();
            }
            assertThat(a.planControls()).extracting(Control::alias).containsExactly("1", "2", "3");
            assertThat(a.planControls().get(1).planControls()).extracting(Control::name)
                    .containsExactly("Databases", "File Servers", "Mail Servers");
        }
    }

    @Nested
    @DisplayName("Reorder and relabel")
    class Reorder {

        @Test
        @DisplayName("should permute siblings and rebuild aliases")
        void reorderChildren() throws Exception {
            Assessment a = HierarchyBuilder.reorder(mfa(), "1", List.of("1.2", "1.1"));

            Control root = a.planControls().get(0);
            assertThat(root.planControls()).extracting(Control::name).containsExactly("Administrative Accounts", "Remote Access");
            assertThat(root.planControls()).extracting(Control::alias).containsExactly("1.1", "1.2");
            assertThat(root.planControls()).extracting(Control::displayable).containsExactly("1.1", "1.2");
        }

        @Test
        @DisplayName("should keep custom labels when aliases move")
        void customLabelsSurvive() throws Exception {
            Assessment a = HierarchyBuilder.relabel(mfa(), "1.2", "ADM");
            a = HierarchyBuilder.reorder(a, "1", List.of("1.2", "1.1"));

            Control first = a.planControls().get(0).planControls().get(0);
            assertThat(first.alias()).isEqualTo("1.1");
            assertThat(first.displayable()).isEqualTo("ADM");
        }

        @Test
        @DisplayName("should reject a sibling label collision")
        void labelCollision() throws Exception {
            assertThatThrownBy(() -> HierarchyBuilder.relabel(mfa(), "1.2", "1.1"))
                    .isInstanceOf(AliasCollisionException.class);
        }

        @Test
        @DisplayName("should reject an order that is not a permutation")
        void notAPermutation() {
            assertThatThrownBy(() -> HierarchyBuilder.reorder(mfa(), "1", List.of("1.1", "1.1")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> HierarchyBuilder.reorder(mfa(), "7", List.of("7.1")))
                    .isInstanceOf(NoSuchElementException.class);
        }
    }
}
