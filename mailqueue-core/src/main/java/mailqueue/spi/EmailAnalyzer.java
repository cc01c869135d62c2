package mailqueue.spi;

import mailqueue.model.EmailAnalysis;
import mailqueue.model.MailMessage;

/**
 * Classifies an inbound message.
 *
 * @see mailqueue.openai.OpenAiEmailAnalyzer
 */
public interface EmailAnalyzer {

    /**
     * @throws EmailAnalysisException when the analysis service fails or answers with unusable output
     */
    EmailAnalysis analyze(MailMessage message);
}
