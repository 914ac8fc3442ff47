package net.lexiconnect.services;

import net.lexiconnect.Util;
import net.lexiconnect.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes corpus statistics over parsed or fetched texts. This is a pure function of
 * the texts it is given.
 */
public class StatisticsService {

    public static StatisticsModel compute(List<TextModel> texts) {
        StatisticsModel stats = new StatisticsModel();
        stats.setTotalTexts(texts.size());
        for (TextModel text : texts) {
            addLanguage(stats, text.getLanguageCode());
            for (SectionModel section : text.getSections()) {
                stats.setTotalSections(stats.getTotalSections() + 1);
                List<WordModel> words = new ArrayList<>(section.getWords());
                for (PhraseModel phrase : section.getPhrases()) {
                    stats.setTotalPhrases(stats.getTotalPhrases() + 1);
                    stats.setTotalWordsTokenized(stats.getTotalWordsTokenized()
                            + Util.tokenize(phrase.getSurfaceText()).size());
                    addLanguage(stats, phrase.getLanguage());
                    words.addAll(phrase.getWords());
                }
                for (WordModel word : words)
                    countWord(stats, word);
            }
        }
        return stats;
    }

    private static void countWord(StatisticsModel stats, WordModel word) {
        stats.setTotalWordsStored(stats.getTotalWordsStored() + 1);
        addLanguage(stats, word.getLanguage());
        for (String tag : word.getPos())
            if (!Util.isEmpty(tag))
                stats.getPosTags().add(tag);

        List<MorphemeModel> morphemes = word.getMorphemes();
        if (morphemes.isEmpty()) {
            if (!Util.isEmpty(word.getGloss()))
                stats.setGlossOnlyWords(stats.getGlossOnlyWords() + 1);
            return;
        }
        stats.setWordsWithMorphemes(stats.getWordsWithMorphemes() + 1);
        for (MorphemeModel morpheme : morphemes) {
            stats.setTotalMorphemes(stats.getTotalMorphemes() + 1);
            String type = morpheme.getType() == null ? "unknown" : morpheme.getType().getValue();
            stats.getMorphemeTypes().merge(type, 1, Integer::sum);
            addLanguage(stats, morpheme.getLanguage());
        }
    }

    private static void addLanguage(StatisticsModel stats, String code) {
        String valid = Util.firstValidLanguage(code);
        if (valid != null)
            stats.getLanguages().add(valid);
    }
}
