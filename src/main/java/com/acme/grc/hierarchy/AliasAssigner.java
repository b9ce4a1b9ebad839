package com.acme.grc.hierarchy;

import com.acme.grc.model.Control;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds aliases for a whole forest in one depth-first pass: root siblings are "1", "2", ...; children of
 * "1" are "1.1", "1.2", .... A displayable that was unset or equal to the previous alias follows the new alias;
 * a deliberately chosen label is kept.
 */
public final class AliasAssigner {
    private AliasAssigner() {}

    public static List<Control> assign(List<Control> controls) {
        return assign(controls, null);
    }

    private static List<Control> assign(List<Control> controls, String parentAlias) {
        List<Control> out = new ArrayList<>(controls.size());
        for (int i = 0; i < controls.size(); i++) {
            Control c = controls.get(i);
            String alias = parentAlias == null ? String.valueOf(i + 1) : parentAlias + "." + (i + 1);
            boolean defaultLabel = c.displayable() == null || c.displayable().isBlank() || c.displayable().equals(c.alias());
            String displayable = defaultLabel ? alias : c.displayable();
            out.add(c.withAlias(alias, displayable, assign(c.planControls(), alias)));
        }
        return out;
    }
}
