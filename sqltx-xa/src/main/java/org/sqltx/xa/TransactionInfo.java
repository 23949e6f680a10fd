package org.sqltx.xa;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One prepared branch reported by the backend's recovery query.
 *
 * <p>{@code data} holds the global transaction id followed by the branch qualifier;
 * {@link #getXid()} is the lossy UTF-8 decoding of the global part.</p>
 */
public final class TransactionInfo {

    private final int formatId;
    private final int gtridLength;
    private final int bqualLength;
    private final byte[] data;
    private final String xid;

    public TransactionInfo(int formatId, int gtridLength, int bqualLength, byte[] data) {
        this.formatId = formatId;
        this.gtridLength = gtridLength;
        this.bqualLength = bqualLength;
        this.data = data != null ? data.clone() : new byte[0];
        int length = Math.max(0, Math.min(gtridLength, this.data.length));
        this.xid = new String(this.data, 0, length, StandardCharsets.UTF_8);
    }

    public int getFormatId() {
        return formatId;
    }

    public int getGtridLength() {
        return gtridLength;
    }

    public int getBqualLength() {
        return bqualLength;
    }

    public byte[] getData() {
        return data.clone();
    }

    public String getXid() {
        return xid;
    }

    /**
     * @return the branch qualifier bytes following the global id, empty when there are none
     */
    public byte[] getBranchQualifier() {
        int start = Math.min(Math.max(gtridLength, 0), data.length);
        int end = Math.min(start + Math.max(bqualLength, 0), data.length);
        return Arrays.copyOfRange(data, start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransactionInfo)) {
            return false;
        }
        TransactionInfo that = (TransactionInfo) o;
        return formatId == that.formatId
                && gtridLength == that.gtridLength
                && bqualLength == that.bqualLength
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(formatId, gtridLength, bqualLength) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "TransactionInfo{" +
                "xid='" + xid + '\'' +
                ", formatId=" + formatId +
                ", gtridLength=" + gtridLength +
                ", bqualLength=" + bqualLength +
                '}';
    }
}
