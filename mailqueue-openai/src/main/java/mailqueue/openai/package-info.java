/** OpenAI chat-completions email classification. */
package mailqueue.openai;
