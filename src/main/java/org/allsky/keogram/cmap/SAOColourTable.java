package org.allsky.keogram.cmap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A colour table sampled from an SAO colour map file, the format ds9 reads
 * and writes. Only PSEUDOCOLOR maps are supported: each of the red, green and
 * blue channels is a piecewise linear curve given as (position, level) pairs,
 * both in the range 0 to 1.
 */
public class SAOColourTable extends ColourTable {

    private static final Pattern POINT = Pattern.compile("\\(([0-9.]+),([0-9.]+)\\)");
    private static final String PSEUDOCOLOR = "PSEUDOCOLOR";

    private enum Channel {
        RED(16), GREEN(8), BLUE(0);

        private final int shift;

        Channel(int shift) {
            this.shift = shift;
        }
    }

    /**
     * Load a colour table from a resource on the class path. Relative names
     * are resolved against this package, so the bundled "aurora.sao" can be
     * loaded by name.
     *
     * @param size The number of entries in the resulting table
     * @param colourMap The resource name
     */
    public SAOColourTable(int size, String colourMap) {
        super(sample(size, parse(colourMap)));
    }

    private static Map<Channel, Curve> parse(String colourMap) {
        InputStream resource = SAOColourTable.class.getResourceAsStream(colourMap);
        if (resource == null) {
            throw new IllegalArgumentException("Missing sao file: " + colourMap);
        }
        try (InputStream input = resource) {
            List<String> lines = significantLines(input);
            if (lines.isEmpty() || !PSEUDOCOLOR.equals(lines.get(0))) {
                throw new IOException("Only " + PSEUDOCOLOR + " colour maps are supported");
            }
            Map<Channel, Curve> curves = new EnumMap<>(Channel.class);
            Curve current = null;
            for (String line : lines.subList(1, lines.size())) {
                if (line.endsWith(":")) {
                    current = new Curve();
                    curves.put(channelNamed(line.substring(0, line.length() - 1)), current);
                } else if (current == null) {
                    throw new IOException("Points found before any channel name: " + line);
                } else {
                    current.addPoints(line);
                }
            }
            for (Channel channel : Channel.values()) {
                Curve curve = curves.get(channel);
                if (curve == null || curve.isEmpty()) {
                    throw new IOException("No points for channel " + channel);
                }
            }
            return curves;
        } catch (IOException x) {
            throw new IllegalArgumentException("Invalid colourmap " + colourMap, x);
        }
    }

    private static Channel channelNamed(String name) throws IOException {
        for (Channel channel : Channel.values()) {
            if (channel.name().equals(name)) {
                return channel;
            }
        }
        throw new IOException("Unknown channel " + name);
    }

    /**
     * Lines with comments (from #) and surrounding blanks removed, skipping
     * lines left empty.
     */
    private static List<String> significantLines(InputStream input) throws IOException {
        List<String> result = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            int hash = line.indexOf('#');
            String content = (hash < 0 ? line : line.substring(0, hash)).trim();
            if (!content.isEmpty()) {
                result.add(content);
            }
        }
        return result;
    }

    private static int[] sample(int size, Map<Channel, Curve> curves) {
        int[] rgb = new int[size];
        for (int i = 0; i < size; i++) {
            double position = size == 1 ? 0 : i / (size - 1.0);
            for (Channel channel : Channel.values()) {
                int level = (int) Math.round(255 * curves.get(channel).levelAt(position));
                rgb[i] |= level << channel.shift;
            }
        }
        return rgb;
    }

    /**
     * Piecewise linear curve, flat beyond its first and last points.
     */
    private static class Curve {

        private final List<double[]> points = new ArrayList<>();

        void addPoints(String line) {
            Matcher matcher = POINT.matcher(line);
            while (matcher.find()) {
                points.add(new double[]{Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2))});
            }
        }

        boolean isEmpty() {
            return points.isEmpty();
        }

        double levelAt(double position) {
            double[] first = points.get(0);
            if (position <= first[0]) {
                return first[1];
            }
            for (int i = 1; i < points.size(); i++) {
                double[] lower = points.get(i - 1);
                double[] upper = points.get(i);
                if (position <= upper[0]) {
                    if (upper[0] == lower[0]) {
                        return upper[1];
                    }
                    return lower[1] + (upper[1] - lower[1]) * (position - lower[0]) / (upper[0] - lower[0]);
                }
            }
            return points.get(points.size() - 1)[1];
        }
    }
}
