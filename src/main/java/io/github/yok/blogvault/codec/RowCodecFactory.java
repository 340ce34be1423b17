package io.github.yok.blogvault.codec;

import lombok.Generated;

/**
 * Selects the {@link RowDecoder} for a {@link DataFormat}.
 *
 * @author Yasuharu.Okawauchi
 */
public final class RowCodecFactory {

    private static final BsonRowCodec BSON = new BsonRowCodec();
    private static final JsonRowCodec JSON = new JsonRowCodec();

    @Generated
    private RowCodecFactory() {}

    /**
     * Returns the decoder for the given format.
     *
     * @param format entry format
     * @return shared, stateless decoder
     */
    public static RowDecoder decoderFor(DataFormat format) {
        switch (format) {
            case BSON:
                return BSON;
            case JSON:
                return JSON;
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    /**
     * Returns the encoder used for every exported entry.
     *
     * @return binary document codec
     */
    public static BsonRowCodec encoder() {
        return BSON;
    }
}
