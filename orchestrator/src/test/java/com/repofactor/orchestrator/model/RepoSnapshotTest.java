package com.repofactor.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RepoSnapshotTest {

    @Test
    void fileWithoutContent_becomesEmptyFile() {
        Map<String, String> files = new HashMap<>();
        files.put("empty.py", null);
        files.put("app.py", "print('hi')\n");

        RepoSnapshot snapshot = new RepoSnapshot("demo", files);

        assertThat(snapshot.files())
                .containsEntry("empty.py", "")
                .containsEntry("app.py", "print('hi')\n");
        assertThat(snapshot.files().keySet()).containsExactly("app.py", "empty.py");
    }

    @Test
    void missingNameAndFiles_giveEmptySnapshot() {
        RepoSnapshot snapshot = new RepoSnapshot(null, null);

        assertThat(snapshot.repoName()).isEmpty();
        assertThat(snapshot.fileCount()).isZero();
    }
}
