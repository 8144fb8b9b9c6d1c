package com.example.pdfhandler.application.service;

import com.example.pdfhandler.application.progress.ProgressSink;
import com.example.pdfhandler.domain.exception.InvalidPageRangeException;
import com.example.pdfhandler.domain.model.BatchOutcome;
import com.example.pdfhandler.domain.model.ItemOutcome;
import com.example.pdfhandler.domain.model.ItemStatus;
import com.example.pdfhandler.domain.model.NamingPattern;
import com.example.pdfhandler.domain.model.PageRange;
import com.example.pdfhandler.domain.model.PartitionSpec;
import com.example.pdfhandler.infrastructure.exception.PdfOpenException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Checks that both engines release every document handle they acquire, on success and on failure,
 * and that outputs are always closed before the sources they copied from.
 */
class EngineResourceSafetyTest {

    @TempDir
    Path tempDir;

    private CountingDocumentGateway gateway;
    private PdfMergeService mergeService;
    private PdfSplitService splitService;

    @BeforeEach
    void setUp() {
        gateway = new CountingDocumentGateway();
        mergeService = new PdfMergeService(gateway);
        splitService = new PdfSplitService(gateway, new SplitPlanner());
    }

    @Test
    void mergeClosesOutputBeforeSources() throws IOException {
        gateway.withPages("a.pdf", 2).withPages("b.pdf", 1);

        mergeService.merge(List.of(file("a.pdf"), file("b.pdf")), tempDir.resolve("out.pdf"));

        assertThat(gateway.openHandles()).isZero();
        assertThat(gateway.events()).containsSubsequence("save out.pdf", "close output out.pdf", "close source a.pdf");
        assertThat(gateway.events()).containsSubsequence("close output out.pdf", "close source b.pdf");
        assertThat(gateway.savedPages("out.pdf")).containsExactly("a.pdf#0", "a.pdf#1", "b.pdf#0");
    }

    /**
     * A source that fails half way has its copied pages removed and is released immediately.
     *
     * @throws IOException when fixtures cannot be created
     */
    @Test
    void mergeRollsBackPartiallyCopiedSource() throws IOException {
        gateway.withPages("a.pdf", 1).withPages("b.pdf", 3).failingAppend("b.pdf", 2).withPages("c.pdf", 1);

        BatchOutcome outcome = mergeService.merge(List.of(file("a.pdf"), file("b.pdf"), file("c.pdf")), tempDir.resolve("out.pdf"));

        assertThat(outcome.items()).extracting(ItemOutcome::status)
                .containsExactly(ItemStatus.SUCCEEDED, ItemStatus.FAILED, ItemStatus.SUCCEEDED);
        assertThat(gateway.savedPages("out.pdf")).containsExactly("a.pdf#0", "c.pdf#0");
        assertThat(gateway.events()).containsSubsequence("open b.pdf", "close source b.pdf", "open c.pdf");
        assertThat(gateway.openHandles()).isZero();
    }

    @Test
    void mergeReleasesHandlesWhenSaveFails() throws IOException {
        gateway.withPages("a.pdf", 2).failingSave("out.pdf");

        BatchOutcome outcome = mergeService.merge(List.of(file("a.pdf")), tempDir.resolve("out.pdf"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).contains("out.pdf");
        assertThat(outcome.items()).extracting(ItemOutcome::status).containsExactly(ItemStatus.SUCCEEDED);
        assertThat(gateway.openHandles()).isZero();
    }

    @Test
    void mergeReleasesHandlesWhenNothingWasCopied() throws IOException {
        gateway.failingOpen("a.pdf").withPages("empty.pdf", 0);

        BatchOutcome outcome = mergeService.merge(List.of(file("a.pdf"), file("empty.pdf")), tempDir.resolve("out.pdf"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.items()).extracting(ItemOutcome::item)
                .containsExactly(tempDir.resolve("a.pdf").toString(), tempDir.resolve("empty.pdf").toString());
        assertThat(outcome.items().get(0).status()).isEqualTo(ItemStatus.FAILED);
        assertThat(outcome.items().get(0).message()).contains("a.pdf");
        assertThat(gateway.openHandles()).isZero();
        assertThat(gateway.events()).doesNotContain("save out.pdf");
    }

    /**
     * The source is opened once and each part output is closed before the next part starts.
     *
     * @throws IOException when the fixture cannot be created
     */
    @Test
    void splitOpensSourceOnceAndClosesEveryPart() throws IOException {
        gateway.withPages("src.pdf", 3);

        splitService.splitByPage(file("src.pdf"), tempDir.resolve("out"), NamingPattern.of("p[N].pdf"), ProgressSink.none());

        assertThat(gateway.events()).filteredOn(event -> event.startsWith("open")).containsExactly("open src.pdf");
        assertThat(gateway.events()).containsSubsequence(
                "create p001.pdf", "close output p001.pdf",
                "create p002.pdf", "close output p002.pdf",
                "create p003.pdf", "close output p003.pdf",
                "close source src.pdf");
        assertThat(gateway.openHandles()).isZero();
    }

    @Test
    void splitReleasesHandlesWhenPartSaveFails() throws IOException {
        gateway.withPages("src.pdf", 4).failingSave("p002.pdf");

        BatchOutcome outcome = splitService.split(file("src.pdf"), PartitionSpec.equal(2), tempDir.resolve("out"),
                NamingPattern.of("p[N].pdf"), ProgressSink.none());

        assertThat(outcome.failedCount()).isEqualTo(1);
        assertThat(gateway.savedPages("p001.pdf")).containsExactly("src.pdf#0", "src.pdf#1");
        assertThat(gateway.openHandles()).isZero();
    }

    @Test
    void splitReleasesSourceWhenRangesAreInvalid() throws IOException {
        gateway.withPages("src.pdf", 4);

        assertThrows(InvalidPageRangeException.class, () -> splitService.splitByRanges(file("src.pdf"),
                List.of(new PageRange(3, 5)), tempDir.resolve("out"), NamingPattern.of("p[N].pdf"), ProgressSink.none()));
        assertThat(gateway.events()).containsExactly("open src.pdf", "close source src.pdf");
        assertThat(gateway.openHandles()).isZero();
    }

    @Test
    void splitPropagatesUnreadableSource() throws IOException {
        gateway.failingOpen("src.pdf");

        assertThrows(PdfOpenException.class, () -> splitService.splitByPage(file("src.pdf"), tempDir.resolve("out"),
                NamingPattern.of("p[N].pdf"), ProgressSink.none()));
        assertThat(gateway.openHandles()).isZero();
    }

    private Path file(String name) throws IOException {
        return Files.createFile(tempDir.resolve(name));
    }
}
