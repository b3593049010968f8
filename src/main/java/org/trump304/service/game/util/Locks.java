package org.trump304.service.game.util;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/** Striped monitors: every action or timeout for one game code goes through the same stripe. */
@Component
public class Locks {
    private final Object[] stripes = new Object[128];
    public Locks() { for (int i=0;i<stripes.length;i++) stripes[i] = new Object(); }
    public Object of(String code) {
        String key = code == null ? null : code.trim().toUpperCase(Locale.ROOT);
        int idx = Math.abs(Objects.hashCode(key)) & (stripes.length - 1);
        return stripes[idx];
    }
}
