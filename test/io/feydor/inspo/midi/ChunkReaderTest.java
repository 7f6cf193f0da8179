package io.feydor.inspo.midi;

import io.feydor.inspo.midi.exceptions.MidiFeatureException;
import io.feydor.inspo.midi.exceptions.MidiTruncatedException;
import io.feydor.inspo.util.ByteFns;
import org.junit.jupiter.api.Test;

import static io.feydor.inspo.midi.SmfFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ChunkReaderTest {
    @Test
    void readsConsecutiveChunks() {
        var cursor = new ByteCursor(concat(track("00FF2F00"), chunk("XFIH", new byte[]{1, 2, 3})));

        var first = ChunkReader.nextChunk(cursor).orElseThrow();
        assertTrue(first.is(MidiIdentifier.MTrk));
        assertEquals(4, first.len());
        assertEquals("00ff2f00", ByteFns.toHex(first.data()));

        var second = ChunkReader.nextChunk(cursor).orElseThrow();
        assertFalse(second.is(MidiIdentifier.MTrk));
        assertEquals("XFIH", second.idString());
        assertArrayEquals(new byte[]{1, 2, 3}, second.data());

        assertTrue(ChunkReader.nextChunk(cursor).isEmpty());
        assertTrue(cursor.atEnd());
    }

    @Test
    void emptyChunk() {
        var chunk = ChunkReader.nextChunk(new ByteCursor(chunk("MTrk", new byte[0]))).orElseThrow();
        assertEquals(0, chunk.len());
        assertEquals(0, chunk.data().length);
    }

    @Test
    void whenFewerThan8BytesRemain_thenEndOfInput() {
        assertTrue(ChunkReader.nextChunk(new ByteCursor(new byte[0])).isEmpty());
        assertTrue(ChunkReader.nextChunk(new ByteCursor(ByteFns.fromHex("4D54726B000000"))).isEmpty());
    }

    @Test
    void whenThePayloadIsShort_thenThrowsTruncated() {
        // MTrk declaring 16 bytes, holding 4
        byte[] bytes = ByteFns.fromHex("4D54726B 00000010 00FF2F00");
        var e = assertThrows(MidiTruncatedException.class, () -> ChunkReader.nextChunk(new ByteCursor(bytes)));
        assertEquals(MidiFeatureException.Kind.TRUNCATED, e.kind());
        assertTrue(e.getMessage().contains("MTrk"), e.getMessage());
    }

    @Test
    void declaredLengthAboveIntegerMaxValue_isTruncated() {
        byte[] bytes = ByteFns.fromHex("4D54726B FFFFFFFF 00");
        assertThrows(MidiTruncatedException.class, () -> ChunkReader.nextChunk(new ByteCursor(bytes)));
    }
}
