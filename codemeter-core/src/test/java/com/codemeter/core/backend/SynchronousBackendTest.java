package com.codemeter.core.backend;

import com.codemeter.core.model.RevisionStatus;
import com.codemeter.core.walk.WalkEntry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SynchronousBackend}.
 */
class SynchronousBackendTest {

    @Test
    void submit_revisesInlineAndReturnsItsStatus() {
        List<Path> revised = new ArrayList<>();
        SynchronousBackend backend = new SynchronousBackend(path -> {
            revised.add(path);
            return path.toString().endsWith(".bad") ? RevisionStatus.IO_ERROR : RevisionStatus.SUCCESS;
        });

        assertThat(backend.initialize()).isEqualTo(RevisionStatus.SUCCESS);
        assertThat(backend.submit(Path.of("a.java"), new WalkEntry("a.java", false, 1)))
            .isEqualTo(RevisionStatus.SUCCESS);
        assertThat(backend.submit(Path.of("b.bad"), new WalkEntry("b.bad", false, 1)))
            .isEqualTo(RevisionStatus.IO_ERROR);
        assertThat(backend.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);

        assertThat(revised).containsExactly(Path.of("a.java"), Path.of("b.bad"));
        assertThat(backend.name()).isEqualTo("sync");
    }

    @Test
    void submit_reviserThrows_reportsPerFileFailureAndKeepsGoing() {
        List<Path> revised = new ArrayList<>();
        SynchronousBackend backend = new SynchronousBackend(path -> {
            if (path.toString().equals("boom.java")) {
                throw new IllegalStateException("boom");
            }
            revised.add(path);
            return RevisionStatus.SUCCESS;
        });
        backend.initialize();

        assertThat(backend.submit(Path.of("boom.java"), new WalkEntry("boom.java", false, 1)))
            .isEqualTo(RevisionStatus.IO_ERROR);
        assertThat(backend.submit(Path.of("ok.java"), new WalkEntry("ok.java", false, 1)))
            .isEqualTo(RevisionStatus.SUCCESS);
        assertThat(backend.drainAndShutdown()).isEqualTo(RevisionStatus.SUCCESS);

        assertThat(revised).containsExactly(Path.of("ok.java"));
    }
}
