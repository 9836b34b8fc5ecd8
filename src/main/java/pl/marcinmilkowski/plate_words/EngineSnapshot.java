package pl.marcinmilkowski.plate_words;

import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndex;
import pl.marcinmilkowski.plate_words.ngram.NGramModel;
import pl.marcinmilkowski.plate_words.scoring.EnsembleScorer;

import java.time.Instant;

/**
 * A consistent set of built structures, installed and replaced as a unit.
 */
public record EngineSnapshot(
    Corpus corpus,
    CorpusIndex index,
    NGramModel ngramModel,
    EnsembleScorer ensemble,
    Instant builtAt
) {
}
