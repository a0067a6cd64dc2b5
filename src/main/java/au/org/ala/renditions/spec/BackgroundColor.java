package au.org.ala.renditions.spec;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.awt.Color;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A colour that transparent pixels are flattened against. Either a solid colour given by name or hex
 * string, or a list of 3 or 4 integer components.
 */
public final class BackgroundColor {

    private static final Pattern HEX = Pattern.compile("^#?([0-9a-f]{3}|[0-9a-f]{6})$");

    private static final Map<String, Color> NAMED = ImmutableMap.<String, Color>builder()
            .put("white", Color.white)
            .put("black", Color.black)
            .put("gray", Color.gray)
            .put("grey", Color.gray)
            .put("darkgray", Color.darkGray)
            .put("lightgray", Color.lightGray)
            .put("red", Color.red)
            .put("green", Color.green)
            .put("blue", Color.blue)
            .put("yellow", Color.yellow)
            .build();

    public static final BackgroundColor WHITE = parse("white");

    private final String solid;
    private final List<Integer> components;
    private final Color color;

    private BackgroundColor(String solid, List<Integer> components, Color color) {
        this.solid = solid;
        this.components = components;
        this.color = color;
    }

    public static BackgroundColor of(int... components) {
        if (components.length != 3 && components.length != 4) {
            throw new InvalidSpecException("Background colour needs 3 or 4 components");
        }
        ImmutableList.Builder<Integer> list = ImmutableList.builder();
        for (int c : components) {
            if (c < 0 || c > 255) {
                throw new InvalidSpecException("Background component out of range: " + c);
            }
            list.add(c);
        }
        Color color = components.length == 4
                ? new Color(components[0], components[1], components[2], components[3])
                : new Color(components[0], components[1], components[2]);
        return new BackgroundColor(null, list.build(), color);
    }

    /**
     * Parse {@code white}, {@code #fff}, {@code #ffffff} or {@code 255,255,255[,255]}.
     */
    public static BackgroundColor parse(String s) {
        if (s == null || s.isBlank()) {
            throw new InvalidSpecException("Background colour is empty");
        }
        String in = s.trim().toLowerCase(Locale.ROOT);
        if (in.contains(",") || in.contains("-")) {
            List<String> parts = Splitter.onPattern("[,-]").trimResults().splitToList(in);
            int[] values = new int[parts.size()];
            try {
                for (int i = 0; i < values.length; i++) {
                    values[i] = Integer.parseInt(parts.get(i));
                }
            } catch (NumberFormatException e) {
                throw new InvalidSpecException("Invalid background colour " + s, e);
            }
            return of(values);
        }
        Color named = NAMED.get(in);
        if (named != null) {
            return new BackgroundColor(in, null, named);
        }
        var matcher = HEX.matcher(in);
        if (!matcher.matches()) {
            throw new InvalidSpecException("Invalid background colour " + s);
        }
        String hex = matcher.group(1);
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        return new BackgroundColor(hex, null, new Color(Integer.parseInt(hex, 16)));
    }

    public Color toColor() {
        return color;
    }

    /** Cache key label: the solid colour, or dash joined components. */
    public String label() {
        return solid != null ? solid : Joiner.on('-').join(components);
    }

    /** Form accepted by {@link #parse(String)} */
    public String canonical() {
        return solid != null ? solid : Joiner.on(',').join(components);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BackgroundColor)) return false;
        BackgroundColor that = (BackgroundColor) o;
        return Objects.equals(solid, that.solid) && Objects.equals(components, that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(solid, components);
    }

    @Override
    public String toString() {
        return "BackgroundColor{" + canonical() + '}';
    }
}
