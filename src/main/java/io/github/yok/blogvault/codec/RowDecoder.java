package io.github.yok.blogvault.codec;

import io.github.yok.blogvault.error.DecodeException;
import io.github.yok.blogvault.model.RowValue;
import java.util.List;
import java.util.Map;

/**
 * Decodes one archive entry payload into generic rows.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RowDecoder {

    /**
     * Decodes a payload. An empty payload yields an empty list.
     *
     * @param payload raw entry bytes
     * @return rows in payload order; each row preserves field order
     * @throws DecodeException if the payload is malformed
     */
    List<Map<String, RowValue>> decode(byte[] payload) throws DecodeException;
}
