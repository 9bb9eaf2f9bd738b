package dev.docsage.corpus;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the lexical corpus snapshot, bound from {@code docsage.corpus.*}.
 *
 * @param snapshotPath JSONL snapshot written by the indexer
 */
@ConfigurationProperties(prefix = "docsage.corpus")
public record CorpusProperties(@DefaultValue("data/index/bm25_corpus.jsonl") Path snapshotPath) {}
