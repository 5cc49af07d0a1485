package com.coderenew.core.scan;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BatchPlanner}.
 */
class BatchPlannerTest {

    private static SourceFile file(String name, int tokens) {
        return new SourceFile(Path.of(name), name, tokens * 4L, tokens, 0);
    }

    private static List<SourceFile> files(int count, int tokens) {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            files.add(file("file-" + i + ".php", tokens));
        }
        return files;
    }

    @Test
    void plan_moreFilesThanFileCeiling_splitsByFileCount() {
        // Given: 25 files of 10,000 tokens each, well within the token ceiling
        BatchPlanner planner = new BatchPlanner(1_000_000, 20);

        // When
        List<FileBatch> batches = planner.plan(files(25, 10_000));

        // Then
        assertThat(batches).extracting(FileBatch::size).containsExactly(20, 5);
        assertThat(batches).extracting(FileBatch::index).containsExactly(0, 1);
    }

    @Test
    void plan_tokenCeiling_startsNewBatch() {
        BatchPlanner planner = new BatchPlanner(150_000, 20);

        List<FileBatch> batches = planner.plan(files(25, 10_000));

        assertThat(batches).extracting(FileBatch::size).containsExactly(15, 10);
        assertThat(batches).allMatch(batch -> batch.totalTokens() <= 150_000);
    }

    @Test
    void plan_coversEveryFileOnceInOrder() {
        BatchPlanner planner = new BatchPlanner(25_000, 3);
        List<SourceFile> input = files(11, 7_000);

        List<FileBatch> batches = planner.plan(input);

        List<SourceFile> flattened = batches.stream().flatMap(batch -> batch.files().stream()).toList();
        assertThat(flattened).containsExactlyElementsOf(input);
        assertThat(batches).allMatch(batch -> !batch.isEmpty() && batch.size() <= 3);
    }

    @Test
    void plan_oversizedFile_getsItsOwnBatch() {
        BatchPlanner planner = new BatchPlanner(1_000, 20);
        List<SourceFile> input = List.of(file("small-a.php", 100), file("huge.php", 50_000), file("small-b.php", 100));

        List<FileBatch> batches = planner.plan(input);

        assertThat(batches).hasSize(3);
        assertThat(batches.get(1).files()).extracting(SourceFile::displayPath).containsExactly("huge.php");
        assertThat(batches.get(1).totalTokens()).isEqualTo(1_000);
    }

    @Test
    void plan_noFiles_returnsNoBatches() {
        assertThat(new BatchPlanner(1_000, 20).plan(List.of())).isEmpty();
    }

    @Test
    void estimateBatchCount_oversizedFile_countsEveryCallNeeded() {
        BatchPlanner planner = new BatchPlanner(1_000, 20);

        assertThat(planner.estimateBatchCount(List.of(file("huge.php", 5_000)))).isEqualTo(5);
        assertThat(planner.estimateBatchCount(List.of(file("exact.php", 1_000)))).isEqualTo(1);
        assertThat(planner.estimateBatchCount(files(25, 10))).isEqualTo(2);
    }

    @Test
    void constructor_nonPositiveLimits_throwException() {
        assertThatThrownBy(() -> new BatchPlanner(0, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BatchPlanner(1_000, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
