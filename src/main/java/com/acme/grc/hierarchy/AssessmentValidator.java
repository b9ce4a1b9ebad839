package com.acme.grc.hierarchy;

import com.acme.grc.model.Assessment;
import com.acme.grc.model.Control;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class AssessmentValidator {
    private AssessmentValidator() {}

    /**
     * Checks metadata and tree invariants.
     *
     * @throws IllegalArgumentException when name or categoryName is missing
     * @throws AliasCollisionException  when aliases or sibling labels violate the tree invariants
     */
    public static Assessment validate(Assessment a) {
        if (a.name() == null || a.name().isBlank()) throw new IllegalArgumentException("Assessment name not found in metadata.name");
        if (a.categoryName() == null || a.categoryName().isBlank()) {
            throw new IllegalArgumentException("categoryName is required in metadata.categoryName");
        }
        if (a.planControls().isEmpty()) throw new IllegalArgumentException("Assessment '" + a.name() + "' has no controls");
        checkSiblings(a.planControls(), null, new HashSet<>());
        return a;
    }

    private static void checkSiblings(List<Control> siblings, String parentAlias, Set<String> seen) {
        Set<String> labels = new HashSet<>();
        for (Control c : siblings) {
            String alias = c.alias();
            if (alias == null || alias.isBlank()) throw new AliasCollisionException(alias, "Control '" + c.name() + "' has no alias");
            if (!extendsParent(alias, parentAlias)) {
                throw new AliasCollisionException(alias, "Alias " + alias + " does not extend parent alias "
                        + (parentAlias == null ? "<root>" : parentAlias));
            }
            if (!seen.add(alias)) throw new AliasCollisionException(alias, "Duplicate alias " + alias);

            String label = c.displayable() == null ? alias : c.displayable();
            if (!labels.add(label)) throw new AliasCollisionException(alias, "Displayable '" + label + "' collides with a sibling of " + alias);

            if (c.isLeaf() != c.planControls().isEmpty()) {
                throw new AliasCollisionException(alias, "Leaf flag of " + alias + " disagrees with its children");
            }
            checkSiblings(c.planControls(), alias, seen);
        }
    }

    static boolean extendsParent(String alias, String parentAlias) {
        String rest;
        if (parentAlias == null) rest = alias;
        else if (alias.startsWith(parentAlias + ".")) rest = alias.substring(parentAlias.length() + 1);
        else return false;
        if (rest.isEmpty()) return false;
        for (char ch : rest.toCharArray()) if (!Character.isDigit(ch)) return false;
        return rest.charAt(0) != '0';
    }
}
