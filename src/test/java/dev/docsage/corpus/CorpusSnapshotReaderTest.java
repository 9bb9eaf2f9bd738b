package dev.docsage.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusSnapshotReaderTest {

  private final CorpusSnapshotReader reader = new CorpusSnapshotReader(new ObjectMapper());

  @TempDir Path tempDir;

  @Test
  void readsSampleSnapshotInFileOrderSkippingBlankRecords() throws URISyntaxException {
    Path snapshot = Path.of(getClass().getResource("/corpus/sample_corpus.jsonl").toURI());

    List<Chunk> chunks = reader.read(snapshot);

    assertThat(chunks).hasSize(3);
    assertThat(chunks.get(0).text()).startsWith("Customers can request a refund");
    assertThat(chunks.get(0).url()).isEqualTo("https://docs.example.com/refunds");
    assertThat(chunks.get(0).title()).isEqualTo("Refund Policy");
    assertThat(chunks.get(0).chunkId()).isEqualTo("0");
    assertThat(chunks.get(2).chunkId()).isEqualTo("7");
  }

  @Test
  void citationUrlFallsBackToSourcePathWhenUrlMissing() throws IOException {
    Path snapshot =
        write(
            """
            {"text": "Shipping takes 3 days.", "metadata": {"source_path": "data/raw/shipping.md"}}
            """);

    Chunk chunk = reader.read(snapshot).get(0);

    assertThat(chunk.url()).isNull();
    assertThat(chunk.sourcePath()).isEqualTo("data/raw/shipping.md");
    assertThat(chunk.citationUrl()).isEqualTo("data/raw/shipping.md");
  }

  @Test
  void recordWithoutMetadataHasNoCitation() throws IOException {
    Path snapshot = write("{\"text\": \"Orphan chunk\"}\n");

    Chunk chunk = reader.read(snapshot).get(0);

    assertThat(chunk.text()).isEqualTo("Orphan chunk");
    assertThat(chunk.citationUrl()).isNull();
  }

  @Test
  void emptyStringMetadataIsTreatedAsAbsent() throws IOException {
    Path snapshot =
        write("{\"text\": \"Chunk\", \"metadata\": {\"url\": \"\", \"source_path\": \"a.md\"}}\n");

    assertThat(reader.read(snapshot).get(0).citationUrl()).isEqualTo("a.md");
  }

  @Test
  void missingSnapshotIsUnavailable() {
    Path missing = tempDir.resolve("absent.jsonl");

    assertThatThrownBy(() -> reader.read(missing))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void malformedLineReportsLineNumber() throws IOException {
    Path snapshot = write("{\"text\": \"ok\"}\n{not json\n");

    assertThatThrownBy(() -> reader.read(snapshot))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void snapshotWithOnlyBlankRecordsIsUnavailable() throws IOException {
    Path snapshot = write("{\"text\": \"\"}\n\n{\"text\": \"  \\n \"}\n");

    assertThatThrownBy(() -> reader.read(snapshot))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessageContaining("no indexable chunks");
  }

  @Test
  void emptyFileIsUnavailable() throws IOException {
    Path snapshot = write("");

    assertThatThrownBy(() -> reader.read(snapshot)).isInstanceOf(IndexUnavailableException.class);
  }

  private Path write(String content) throws IOException {
    Path snapshot = tempDir.resolve("bm25_corpus.jsonl");
    Files.writeString(snapshot, content, StandardCharsets.UTF_8);
    return snapshot;
  }
}
