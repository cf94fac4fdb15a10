package ai.batch.translator.translate;

/**
 * Receives partial output while a batch is being translated.
 */
@FunctionalInterface
public interface TranslationListener {

    TranslationListener NONE = fragment -> { };

    /**
     * Called for every streamed content fragment, in arrival order.
     */
    void onFragment(String fragment);

    /**
     * Called once when a non-streamed response body has been received.
     */
    default void onReceived(int characterCount) {
    }
}
