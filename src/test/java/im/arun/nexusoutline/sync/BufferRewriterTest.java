package im.arun.nexusoutline.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import im.arun.nexusoutline.buffer.InMemoryTextBuffer;
import im.arun.nexusoutline.buffer.SharedTextBuffer;
import im.arun.nexusoutline.buffer.StaleSnapshotException;
import im.arun.nexusoutline.buffer.TextSnapshot;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("BufferRewriter Tests")
class BufferRewriterTest {

    @Mock
    private SharedTextBuffer mockBuffer;

    private BufferRewriter rewriter;

    @BeforeEach
    void setUp() {
        rewriter = new BufferRewriter();
    }

    @Test
    @DisplayName("should apply mutations against original indices regardless of submission order")
    void shouldApplyAgainstOriginalIndices() {
        List<String> lines = List.of("a", "b", "c", "d");

        List<String> result = rewriter.apply(lines, List.of(
            LineMutation.insert(1, List.of("x")),
            LineMutation.delete(2),
            LineMutation.replace(3, "D")));

        assertThat(result).containsExactly("a", "x", "b", "D");
    }

    @Test
    @DisplayName("should replace, then delete, then insert at the same index")
    void shouldOrderMutationsAtSameIndex() {
        List<String> lines = List.of("a", "b", "c");

        List<String> result = rewriter.apply(lines, List.of(
            LineMutation.insert(1, List.of("new")),
            LineMutation.delete(1),
            LineMutation.replace(1, "B")));

        assertThat(result).containsExactly("a", "new", "c");
    }

    @Test
    @DisplayName("should delete a line queued twice only once")
    void shouldDeduplicateDeletes() {
        List<String> result = rewriter.apply(List.of("a", "b", "c"),
            List.of(LineMutation.delete(1), LineMutation.delete(1)));

        assertThat(result).containsExactly("a", "c");
    }

    @Test
    @DisplayName("should append when inserting at the line count and ignore out-of-range edits")
    void shouldAppendAndIgnoreOutOfRange() {
        List<String> result = rewriter.apply(List.of("a", "b"), List.of(
            LineMutation.insert(2, List.of("c", "d")),
            LineMutation.replace(9, "zzz"),
            LineMutation.delete(-1)));

        assertThat(result).containsExactly("a", "b", "c", "d");
    }

    @Test
    @DisplayName("should not modify the input list")
    void shouldLeaveInputUntouched() {
        List<String> lines = List.of("a", "b");

        rewriter.apply(lines, List.of(LineMutation.delete(0)));

        assertThat(lines).containsExactly("a", "b");
    }

    @Test
    @DisplayName("should commit the rewritten text as one transaction")
    void shouldCommitOnce_whenMutationsChangeText() {
        InMemoryTextBuffer buffer = new InMemoryTextBuffer("a\nb\n");
        TextSnapshot snapshot = buffer.snapshot();

        boolean changed = rewriter.commit(buffer, snapshot, List.of(
            LineMutation.replace(0, "A"),
            LineMutation.insert(2, List.of("c"))));

        assertThat(changed).isTrue();
        assertThat(buffer.read()).isEqualTo("A\nb\nc\n");
        assertThat(buffer.version()).isEqualTo(1);
    }

    @Test
    @DisplayName("should skip the transaction when mutations leave the text unchanged")
    void shouldNotTransact_whenTextUnchanged() {
        TextSnapshot snapshot = new TextSnapshot("a\nb", 3);
        when(mockBuffer.version()).thenReturn(3L);

        boolean changed = rewriter.commit(mockBuffer, snapshot, List.of(LineMutation.replace(1, "b")));

        assertThat(changed).isFalse();
        assertThat(snapshot.isConsumed()).isTrue();
        verify(mockBuffer, never()).transact(anyLong(), anyString());
    }

    @Test
    @DisplayName("should skip the transaction when there are no mutations")
    void shouldNotTransact_whenNoMutations() {
        TextSnapshot snapshot = new TextSnapshot("a", 0);
        when(mockBuffer.version()).thenReturn(0L);

        assertThat(rewriter.commit(mockBuffer, snapshot, List.of())).isFalse();
        verify(mockBuffer, never()).transact(anyLong(), anyString());
    }

    @Test
    @DisplayName("should reject a snapshot the buffer has moved past")
    void shouldThrow_whenSnapshotStale() {
        InMemoryTextBuffer buffer = new InMemoryTextBuffer("a");
        TextSnapshot snapshot = buffer.snapshot();
        buffer.transact("b");

        assertThatThrownBy(() -> rewriter.commit(buffer, snapshot, List.of(LineMutation.replace(0, "c"))))
            .isInstanceOf(StaleSnapshotException.class)
            .hasMessageContaining("does not match");
        assertThat(buffer.read()).isEqualTo("b");
    }

    @Test
    @DisplayName("should not overwrite a write that lands between the version check and the commit")
    void shouldThrow_whenBufferChangesDuringCommit() {
        InMemoryTextBuffer buffer = new InMemoryTextBuffer("a\nb") {
            private boolean interleaved;

            @Override
            public synchronized long version() {
                long seen = super.version();
                if (!interleaved) {
                    interleaved = true;
                    transact("OTHER WRITER");
                }
                return seen;
            }
        };
        TextSnapshot snapshot = buffer.snapshot();

        assertThatThrownBy(() -> rewriter.commit(buffer, snapshot, List.of(LineMutation.replace(0, "A"))))
            .isInstanceOf(StaleSnapshotException.class)
            .hasMessageContaining("while committing");
        assertThat(buffer.read()).isEqualTo("OTHER WRITER");
        assertThat(buffer.version()).isEqualTo(1);
    }

    @Test
    @DisplayName("should throw when the buffer rejects the conditional transaction")
    void shouldThrow_whenConditionalTransactRejected() {
        TextSnapshot snapshot = new TextSnapshot("a", 4);
        when(mockBuffer.version()).thenReturn(4L);
        when(mockBuffer.transact(eq(4L), anyString())).thenReturn(false);

        assertThatThrownBy(() -> rewriter.commit(mockBuffer, snapshot, List.of(LineMutation.replace(0, "b"))))
            .isInstanceOf(StaleSnapshotException.class);
        verify(mockBuffer).transact(4L, "b");
    }

    @Test
    @DisplayName("should keep CRLF line endings on every line it rewrites")
    void shouldPreserveCrlf_whenCommitting() {
        InMemoryTextBuffer buffer = new InMemoryTextBuffer("a\r\nb\r\n");

        rewriter.commit(buffer, buffer.snapshot(), List.of(LineMutation.insert(1, List.of("x"))));

        assertThat(buffer.read()).isEqualTo("a\r\nx\r\nb\r\n");
    }

    @Test
    @DisplayName("should reject a second commit from the same snapshot")
    void shouldThrow_whenSnapshotReused() {
        InMemoryTextBuffer buffer = new InMemoryTextBuffer("a");
        TextSnapshot snapshot = buffer.snapshot();
        rewriter.commit(buffer, snapshot, List.of());

        assertThatThrownBy(() -> rewriter.commit(buffer, snapshot, List.of(LineMutation.replace(0, "c"))))
            .isInstanceOf(StaleSnapshotException.class);
        assertThat(buffer.read()).isEqualTo("a");
    }
}
