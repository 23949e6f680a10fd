package org.sqltx.xa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TransactionInfoTest {

    @Test
    @DisplayName("xid is the global part of data, the rest is the branch qualifier")
    void testSplitData() {
        byte[] data = "gtrid-1bq".getBytes(StandardCharsets.UTF_8);

        TransactionInfo info = new TransactionInfo(1, 7, 2, data);

        assertEquals("gtrid-1", info.getXid());
        assertArrayEquals("bq".getBytes(StandardCharsets.UTF_8), info.getBranchQualifier());
        assertEquals(1, info.getFormatId());
    }

    @Test
    @DisplayName("lengths beyond the data are clamped")
    void testClampedLengths() {
        TransactionInfo info = new TransactionInfo(1, 40, 5, "short".getBytes(StandardCharsets.UTF_8));

        assertEquals("short", info.getXid());
        assertEquals(0, info.getBranchQualifier().length);
        assertEquals("", new TransactionInfo(1, 3, 0, null).getXid());
    }

    @Test
    @DisplayName("data is copied in and out")
    void testDataCopies() {
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);
        TransactionInfo info = new TransactionInfo(1, 3, 0, data);

        data[0] = 'z';
        info.getData()[1] = 'z';

        assertEquals("abc", info.getXid());
        assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), info.getData());
        assertEquals(new TransactionInfo(1, 3, 0, "abc".getBytes(StandardCharsets.UTF_8)), info);
    }
}
