package com.designauditor.color;

import java.util.List;

/**
 * Display-only grouping of canonical colors that read as shades of one color.
 */
public record ColorFamily(String mainHex, List<String> variations, int totalInstances) {
    public ColorFamily {
        variations = List.copyOf(variations);
    }
}
