package ai.batch.translator.job;

import ai.batch.translator.config.TranslatorConfig;
import ai.batch.translator.translate.Translator;

/**
 * Supplies the translator used by a job, given that job's settings.
 */
@FunctionalInterface
public interface TranslatorSource {

    Translator create(TranslatorConfig config);
}
