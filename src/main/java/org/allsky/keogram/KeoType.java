package org.allsky.keogram;

/**
 * How strips are placed into a keogram.
 */
public enum KeoType {

    /**
     * The whole strip is copied into the keogram, centred on the column of
     * its capture time.
     */
    COPY_PASTE("CopyPaste") {
        @Override
        public int placementWidth(int stripWidth) {
            return stripWidth;
        }

        @Override
        public int maxGap(double dataSpacing) {
            return (int) (1.5 * dataSpacing);
        }

        @Override
        public int interpolationWidth(int stripWidth) {
            return stripWidth;
        }
    },
    /**
     * The strip is averaged across its width and written as a single column.
     */
    AVERAGE("Average") {
        @Override
        public int placementWidth(int stripWidth) {
            return AVERAGE_PLACEMENT_WIDTH;
        }

        @Override
        public int maxGap(double dataSpacing) {
            return (int) (1.5 * (dataSpacing + AVERAGE_PLACEMENT_WIDTH));
        }

        @Override
        public int interpolationWidth(int stripWidth) {
            return 1;
        }
    };

    static final int AVERAGE_PLACEMENT_WIDTH = 5;

    private final String typeName;

    KeoType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * The strip width used to lay out the time axis.
     *
     * @param stripWidth The requested extraction width
     * @return The width reserved for each strip
     */
    public abstract int placementWidth(int stripWidth);

    /**
     * The widest gap, in pixels, bridged by interpolation.
     *
     * @param dataSpacing Typical spacing between data points, in pixels
     * @return The maximum gap
     */
    public abstract int maxGap(double dataSpacing);

    /**
     * The width of the data written at each data point.
     *
     * @param stripWidth The strip width stored in the keogram
     * @return The width used when interpolating
     */
    public abstract int interpolationWidth(int stripWidth);

    public String getTypeName() {
        return typeName;
    }

    public static KeoType fromName(String name) {
        for (KeoType type : values()) {
            if (type.typeName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown keogram type \"" + name + "\", expecting \"CopyPaste\" or \"Average\"");
    }
}
