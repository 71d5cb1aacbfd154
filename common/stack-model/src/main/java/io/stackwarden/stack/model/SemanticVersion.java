package io.stackwarden.stack.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Loose semantic version ordering: dotted numeric components are compared numerically, a leading
 * {@code v} and build metadata are ignored, and a pre-release sorts before its release.
 * Non-numeric components fall back to lexical comparison.
 */
public final class SemanticVersion {

    private SemanticVersion() {
    }

    public static int compare(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        String[] aParts = splitRelease(a);
        String[] bParts = splitRelease(b);
        List<String> aCore = components(aParts[0]);
        List<String> bCore = components(bParts[0]);
        int size = Math.max(aCore.size(), bCore.size());
        for (int i = 0; i < size; i++) {
            String x = i < aCore.size() ? aCore.get(i) : "0";
            String y = i < bCore.size() ? bCore.get(i) : "0";
            int cmp = compareComponent(x, y);
            if (cmp != 0) {
                return cmp;
            }
        }
        if (aParts[1] == null && bParts[1] == null) {
            return 0;
        }
        if (aParts[1] == null) {
            return 1;
        }
        if (bParts[1] == null) {
            return -1;
        }
        return aParts[1].compareTo(bParts[1]);
    }

    public static boolean isDowngrade(String current, String target) {
        if (current == null || target == null) {
            return false;
        }
        return compare(target, current) < 0;
    }

    private static String normalize(String version) {
        String value = version == null ? "" : version.trim();
        if (value.startsWith("v") || value.startsWith("V")) {
            value = value.substring(1);
        }
        int plus = value.indexOf('+');
        return plus >= 0 ? value.substring(0, plus) : value;
    }

    private static String[] splitRelease(String version) {
        int dash = version.indexOf('-');
        if (dash < 0) {
            return new String[] {version, null};
        }
        return new String[] {version.substring(0, dash), version.substring(dash + 1)};
    }

    private static List<String> components(String core) {
        List<String> parts = new ArrayList<>();
        for (String part : core.split("\\.")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static int compareComponent(String x, String y) {
        boolean xNumeric = x.chars().allMatch(Character::isDigit);
        boolean yNumeric = y.chars().allMatch(Character::isDigit);
        if (xNumeric && yNumeric) {
            return new BigInteger(x).compareTo(new BigInteger(y));
        }
        return x.compareTo(y);
    }
}
