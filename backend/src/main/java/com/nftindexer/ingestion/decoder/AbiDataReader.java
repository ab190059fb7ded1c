package com.nftindexer.ingestion.decoder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads 32-byte ABI words from the hex data of a log. Word indexes are zero-based head positions;
 * dynamic arrays are followed through their byte offset.
 */
final class AbiDataReader {

    private static final int WORD_HEX = 64;
    private static final BigInteger MAX_WORDS = BigInteger.valueOf(Integer.MAX_VALUE / WORD_HEX);

    private final String hex;
    private final int wordCount;

    private AbiDataReader(String hex) {
        this.hex = hex;
        this.wordCount = hex.length() / WORD_HEX;
    }

    static AbiDataReader of(String data) {
        if (data == null || !(data.startsWith("0x") || data.startsWith("0X"))) {
            throw new DecodeException("Log data must be 0x-prefixed hex");
        }
        String body = data.substring(2).toLowerCase(Locale.ROOT);
        if (body.length() % WORD_HEX != 0) {
            throw new DecodeException("Log data length " + body.length() / 2 + " is not a multiple of 32 bytes");
        }
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
                throw new DecodeException("Log data contains non-hex character at " + i);
            }
        }
        return new AbiDataReader(body);
    }

    int wordCount() {
        return wordCount;
    }

    /** Fails fast when the static head is shorter than the event layout requires. */
    AbiDataReader requireWords(int minWords) {
        if (wordCount < minWords) {
            throw new DecodeException("Expected at least " + minWords + " words, got " + wordCount);
        }
        return this;
    }

    String word(int index) {
        if (index < 0 || index >= wordCount) {
            throw new DecodeException("Word " + index + " out of range (" + wordCount + " words)");
        }
        return hex.substring(index * WORD_HEX, (index + 1) * WORD_HEX);
    }

    BigInteger uint(int index) {
        return new BigInteger(word(index), 16);
    }

    String address(int index) {
        String w = word(index);
        if (!w.startsWith("0".repeat(24))) {
            throw new DecodeException("Word " + index + " is not a left-padded address");
        }
        return "0x" + w.substring(24);
    }

    String bytes32(int index) {
        return "0x" + word(index);
    }

    boolean bool(int index) {
        BigInteger v = uint(index);
        if (v.signum() == 0) return false;
        if (v.equals(BigInteger.ONE)) return true;
        throw new DecodeException("Word " + index + " is not a bool");
    }

    List<BigInteger> uintArray(int headIndex) {
        int start = offsetToWord(headIndex);
        BigInteger rawLength = uint(start);
        if (rawLength.compareTo(MAX_WORDS) > 0 || start + 1 + rawLength.intValue() > wordCount) {
            throw new DecodeException("Array at word " + headIndex + " overruns data");
        }
        int length = rawLength.intValue();
        List<BigInteger> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(uint(start + 1 + i));
        }
        return out;
    }

    List<BigInteger> fixedUintArray(int fromIndex, int length) {
        List<BigInteger> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(uint(fromIndex + i));
        }
        return out;
    }

    List<String> fixedAddressArray(int fromIndex, int length) {
        List<String> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(address(fromIndex + i));
        }
        return out;
    }

    private int offsetToWord(int headIndex) {
        BigInteger offset = uint(headIndex);
        if (offset.mod(BigInteger.valueOf(32)).signum() != 0
                || offset.divide(BigInteger.valueOf(32)).compareTo(BigInteger.valueOf(wordCount)) >= 0) {
            throw new DecodeException("Invalid array offset " + offset + " at word " + headIndex);
        }
        return offset.divide(BigInteger.valueOf(32)).intValue();
    }
}
