package com.libragraph.sift.formats.registry;

import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.Signature;
import com.libragraph.sift.util.buffer.ByteRegion;
import com.libragraph.sift.util.buffer.RamBuffer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SignatureIndexTest {

    private static ByteRegion region(byte[] bytes) {
        return ByteRegion.of(new RamBuffer(bytes));
    }

    private static SignatureIndex index(FormatParser<?>... parsers) {
        ParserRegistry.Builder builder = ParserRegistry.builder();
        for (FormatParser<?> parser : parsers) {
            builder.register(parser);
        }
        return builder.build().signatureIndex();
    }

    @Test
    void shouldReturnCandidatesInRegistrationOrder() {
        StubParser specific = new StubParser("specific", Signature.ascii(0, "MAGIC"));
        StubParser generic = new StubParser("generic", Signature.ascii(0, "MA"));
        SignatureIndex index = index(specific, generic);

        byte[] data = "xxMAGICyy".getBytes();
        assertThat(index.candidatesAt(region(data), 2)).containsExactly(specific, generic);
        assertThat(index.candidatesAt(region(data), 3)).isEmpty();
    }

    @Test
    void shouldListParserOnceWhenSeveralSignaturesMatch() {
        StubParser multi = new StubParser("multi", Signature.ascii(0, "AB"), Signature.ascii(0, "A"));
        SignatureIndex index = index(multi);

        assertThat(index.candidatesAt(region("AB".getBytes()), 0)).containsExactly(multi);
    }

    @Test
    void shouldMatchSignaturesAtNonZeroOffsets() {
        StubParser tar = new StubParser("tar", Signature.ascii(257, "ustar"));
        SignatureIndex index = index(tar);

        byte[] data = new byte[1000];
        System.arraycopy("ustar".getBytes(), 0, data, 300 + 257, 5);

        assertThat(index.candidatesAt(region(data), 300)).containsExactly(tar);
        assertThat(index.nextCandidateOffset(region(data), 0)).isEqualTo(300);
    }

    @Test
    void shouldFindNextCandidateAcrossChunks() {
        StubParser bmp = new StubParser("bmp", Signature.ascii(0, "BM"));
        SignatureIndex index = index(bmp);

        byte[] data = new byte[200_000];
        data[65_535] = 'B';
        data[65_536] = 'M';
        data[150_000] = 'B';
        data[150_001] = 'M';

        assertThat(index.nextCandidateOffset(region(data), 0)).isEqualTo(65_535);
        assertThat(index.nextCandidateOffset(region(data), 65_536)).isEqualTo(150_000);
        assertThat(index.nextCandidateOffset(region(data), 150_001)).isEqualTo(-1);
    }

    @Test
    void shouldNotMatchPatternCutOffByRegionEnd() {
        StubParser bmp = new StubParser("bmp", Signature.ascii(0, "BMP"));
        SignatureIndex index = index(bmp);

        byte[] data = "xxxBMP".getBytes();
        ByteRegion truncated = region(data).slice(0, 5);

        assertThat(index.nextCandidateOffset(truncated, 0)).isEqualTo(-1);
        assertThat(index.candidatesAt(truncated, 3)).isEmpty();
    }

    @Test
    void shouldReportMinimumSignatureLength() {
        SignatureIndex index = index(
                new StubParser("a", Signature.ascii(0, "ABCD")),
                new StubParser("b", Signature.ascii(0, "XY")));

        assertThat(index.minimumSignatureLength()).isEqualTo(2);
        assertThat(index(new StubParser("raw")).minimumSignatureLength()).isZero();
        assertThat(index(new StubParser("raw")).isEmpty()).isTrue();
    }
}
