package ai.batch.translator.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class LinePartitionerTest {

    @Test
    void keepsHeaderAndChunksRemainingLines() {
        PartitionResult result = new LinePartitioner(2).partition("0:::meta\n1:::a\n2:::b\n3:::c");

        assertThat(result.initialLines()).containsExactly("0:::meta", "1:::", "2:::", "3:::");
        assertThat(result.batches()).hasSize(2);
        assertThat(result.batches().get(0).indices()).containsExactly(1, 2);
        assertThat(result.batches().get(0).lines()).containsExactly("1:::a", "2:::b");
        assertThat(result.batches().get(1).indices()).containsExactly(3);
        assertThat(result.batches().get(1).number()).isEqualTo(1);
    }

    @Test
    void everyIndexBelongsToExactlyOneBatch() {
        StringBuilder content = new StringBuilder();
        for (int i = 1; i <= 23; i++) {
            content.append(i).append(":::line ").append(i).append('\n');
        }

        PartitionResult result = new LinePartitioner(5).partition(content.toString());

        assertThat(result.lineCount()).isEqualTo(23);
        assertThat(result.batchCount()).isEqualTo(5);
        assertThat(result.batches().stream().flatMap(batch -> batch.indices().stream()).toList())
                .containsExactlyElementsOf(IntStream.range(0, 23).boxed().toList());
    }

    @Test
    void linesWithoutSeparatorAreWorkItemsButKeepTheirText() {
        PartitionResult result = new LinePartitioner(10).partition("1:::a\nfree text\n2:::b");

        assertThat(result.initialLines()).containsExactly("1:::", "free text", "2:::");
        assertThat(result.batches().get(0).lines()).containsExactly("1:::a", "free text", "2:::b");
    }

    @Test
    void headerOnlyCountsOnFirstLine() {
        PartitionResult result = new LinePartitioner(10).partition("1:::a\n0:::late");

        assertThat(result.initialLines()).containsExactly("1:::", "0:::");
        assertThat(result.batches().get(0).indices()).containsExactly(0, 1);
    }

    @Test
    void emptyInputHasNoBatches() {
        PartitionResult result = new LinePartitioner(10).partition("");

        assertThat(result.initialLines()).isEmpty();
        assertThat(result.batches()).isEmpty();
    }

    @Test
    void nonPositiveBatchSizeIsClampedToOne() {
        PartitionResult result = new LinePartitioner(0).partition("1:::a\n2:::b");

        assertThat(result.batchCount()).isEqualTo(2);
    }

    @Test
    void repartitioningPartialOutputYieldsSameBuffer() {
        LinePartitioner partitioner = new LinePartitioner(2);
        String source = "0:::meta\n1:::Hello\n 2 :::World\nplain";
        String partial = "0:::meta\n1:::Bonjour\n2:::\nplain";

        assertThat(partitioner.partition(partial).initialLines())
                .isEqualTo(partitioner.partition(source).initialLines());
    }

    @Test
    void batchLabelsUseFirstAndLastIds() {
        Batch batch = new LinePartitioner(3).partition("7:::a\n8:::b\n9:::c").batches().get(0);

        assertThat(batch.firstLabel()).isEqualTo("7");
        assertThat(batch.lastLabel()).isEqualTo("9");
        assertThat(batch.size()).isEqualTo(3);
    }
}
