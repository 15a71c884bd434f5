package org.starcull.imageio.xisf;

/**
 * Raw sample encodings. Only unsigned 16 bit samples are read.
 *
 * @author tonyj
 */
public enum SampleFormat {

    UINT16("UInt16", 2);

    private final String xisfName;
    private final int bytesPerSample;

    SampleFormat(String xisfName, int bytesPerSample) {
        this.xisfName = xisfName;
        this.bytesPerSample = bytesPerSample;
    }

    public String getXisfName() {
        return xisfName;
    }

    public int getBytesPerSample() {
        return bytesPerSample;
    }

    static SampleFormat forXisfName(String name) {
        for (SampleFormat format : values()) {
            if (format.xisfName.equalsIgnoreCase(name)) {
                return format;
            }
        }
        return null;
    }
}
