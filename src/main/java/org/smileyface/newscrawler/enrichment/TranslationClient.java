package org.smileyface.newscrawler.enrichment;

/**
 * Remote machine translation service.
 */
public interface TranslationClient {

    /**
     * @return language code of the text, e.g. "en"
     */
    String detectLanguage(String text) throws TranslationException;

    /**
     * @param text             text to translate
     * @param sourceLanguage   language of the text
     * @param targetLanguage   language to translate into
     * @return the translated text
     */
    String translate(String text, String sourceLanguage, String targetLanguage) throws TranslationException;
}
