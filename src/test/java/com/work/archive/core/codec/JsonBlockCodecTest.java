package com.work.archive.core.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.archive.core.exception.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class JsonBlockCodecTest {

    private final JsonBlockCodec codec = new JsonBlockCodec(new ObjectMapper());

    @Test
    public void decodes_extrinsics_and_events_in_order() {
        String body = "{\"extrinsics\":[{\"module\":\"Timestamp\",\"call\":\"set\",\"args\":{\"now\":6000}},"
                + "{\"module\":\"Balances\",\"call\":\"transfer\",\"signature\":\"0x0a0b\"}],"
                + "\"events\":[{\"module\":\"System\",\"event\":\"ExtrinsicSuccess\",\"params\":{\"w\":1}}]}";

        DecodedBody out = codec.decode(body.getBytes(StandardCharsets.UTF_8), 3, new byte[0]);

        assertEquals(2, out.getExtrinsics().size());
        DecodedExtrinsic first = out.getExtrinsics().get(0);
        assertEquals(0, first.getIndex());
        assertEquals("Timestamp", first.getModule());
        assertEquals("set", first.getCallName());
        assertNull(first.getSignature());
        assertEquals("{\"now\":6000}", first.getArgsJson());

        DecodedExtrinsic second = out.getExtrinsics().get(1);
        assertEquals(1, second.getIndex());
        assertArrayEquals(new byte[]{0x0a, 0x0b}, second.getSignature());
        assertEquals("{}", second.getArgsJson());

        assertEquals(1, out.getEvents().size());
        assertEquals("ExtrinsicSuccess", out.getEvents().get(0).getEventName());
    }

    @Test
    public void empty_body_decodes_to_empty_block() {
        DecodedBody out = codec.decode(new byte[0], 1, null);
        assertTrue(out.getExtrinsics().isEmpty());
        assertTrue(out.getEvents().isEmpty());
    }

    @Test
    public void malformed_body_is_decode_error() {
        assertThrows(DecodeException.class,
                () -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8), 1, null));
        assertThrows(DecodeException.class,
                () -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8), 1, null));
    }

    @Test
    public void missing_call_name_is_decode_error() {
        String body = "{\"extrinsics\":[{\"module\":\"Timestamp\"}]}";
        assertThrows(DecodeException.class,
                () -> codec.decode(body.getBytes(StandardCharsets.UTF_8), 1, null));
    }
}
