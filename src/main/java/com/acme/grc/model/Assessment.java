package com.acme.grc.model;

import java.util.ArrayList;
import java.util.List;

public record Assessment(String name, String description, String categoryName, List<Control> planControls) {
    public Assessment {
        planControls = planControls == null ? List.of() : List.copyOf(planControls);
    }

    public Assessment withControls(List<Control> controls) {
        return new Assessment(name, description, categoryName, controls);
    }

    /** All controls in depth-first order. */
    public List<Control> flatten() {
        List<Control> out = new ArrayList<>();
        for (Control c : planControls) collect(c, out);
        return out;
    }

    private static void collect(Control c, List<Control> out) {
        out.add(c);
        for (Control child : c.planControls()) collect(child, out);
    }
}
