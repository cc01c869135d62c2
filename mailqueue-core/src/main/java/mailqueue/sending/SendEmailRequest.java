package mailqueue.sending;

import mailqueue.model.OutboundAttachment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Request to send mail from a connected mailbox. Use {@link #builder(long, long)}.
 */
public final class SendEmailRequest {
    private final long connectionId;
    private final long userId;
    private final List<String> to;
    private final List<String> cc;
    private final List<String> bcc;
    private final List<String> replyTo;
    private final String subject;
    private final String bodyText;
    private final String bodyHtml;
    private final String importance;
    private final List<OutboundAttachment> attachments;
    private final String inReplyTo;
    private final Long linkedConversationId;
    private final Long linkedContactId;
    private final Long linkedPropertyId;
    private final String templateUsed;

    private SendEmailRequest(Builder builder) {
        this.connectionId = builder.connectionId;
        this.userId = builder.userId;
        this.to = List.copyOf(builder.to);
        if (this.to.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient is required");
        }
        this.subject = Objects.requireNonNull(builder.subject, "subject");
        this.cc = List.copyOf(builder.cc);
        this.bcc = List.copyOf(builder.bcc);
        this.replyTo = List.copyOf(builder.replyTo);
        this.bodyText = builder.bodyText;
        this.bodyHtml = builder.bodyHtml;
        this.importance = builder.importance == null ? "normal" : builder.importance;
        this.attachments = Collections.unmodifiableList(new ArrayList<>(builder.attachments));
        this.inReplyTo = builder.inReplyTo;
        this.linkedConversationId = builder.linkedConversationId;
        this.linkedContactId = builder.linkedContactId;
        this.linkedPropertyId = builder.linkedPropertyId;
        this.templateUsed = builder.templateUsed;
    }

    public static Builder builder(long connectionId, long userId) {
        return new Builder(connectionId, userId);
    }

    public long connectionId() {
        return connectionId;
    }

    public long userId() {
        return userId;
    }

    public List<String> to() {
        return to;
    }

    public List<String> cc() {
        return cc;
    }

    public List<String> bcc() {
        return bcc;
    }

    public List<String> replyTo() {
        return replyTo;
    }

    public String subject() {
        return subject;
    }

    public String bodyText() {
        return bodyText;
    }

    public String bodyHtml() {
        return bodyHtml;
    }

    public String importance() {
        return importance;
    }

    public List<OutboundAttachment> attachments() {
        return attachments;
    }

    public String inReplyTo() {
        return inReplyTo;
    }

    public Long linkedConversationId() {
        return linkedConversationId;
    }

    public Long linkedContactId() {
        return linkedContactId;
    }

    public Long linkedPropertyId() {
        return linkedPropertyId;
    }

    public String templateUsed() {
        return templateUsed;
    }

    /**
     * Builder for {@link SendEmailRequest}. {@code to} and {@code subject} are required.
     */
    public static final class Builder {
        private final long connectionId;
        private final long userId;
        private final List<String> to = new ArrayList<>();
        private final List<String> cc = new ArrayList<>();
        private final List<String> bcc = new ArrayList<>();
        private final List<String> replyTo = new ArrayList<>();
        private final List<OutboundAttachment> attachments = new ArrayList<>();
        private String subject;
        private String bodyText;
        private String bodyHtml;
        private String importance;
        private String inReplyTo;
        private Long linkedConversationId;
        private Long linkedContactId;
        private Long linkedPropertyId;
        private String templateUsed;

        private Builder(long connectionId, long userId) {
            this.connectionId = connectionId;
            this.userId = userId;
        }

        public Builder to(List<String> addresses) {
            this.to.addAll(addresses);
            return this;
        }

        public Builder to(String address) {
            this.to.add(address);
            return this;
        }

        public Builder cc(List<String> addresses) {
            this.cc.addAll(addresses);
            return this;
        }

        public Builder bcc(List<String> addresses) {
            this.bcc.addAll(addresses);
            return this;
        }

        public Builder replyTo(List<String> addresses) {
            this.replyTo.addAll(addresses);
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder bodyText(String bodyText) {
            this.bodyText = bodyText;
            return this;
        }

        public Builder bodyHtml(String bodyHtml) {
            this.bodyHtml = bodyHtml;
            return this;
        }

        /**
         * {@code low}, {@code normal} or {@code high}. Defaults to {@code normal}.
         */
        public Builder importance(String importance) {
            this.importance = importance;
            return this;
        }

        /**
         * Adds an attachment from base64 content; the stored size is estimated from the encoding.
         */
        public Builder attachment(String name, String contentType, String contentBase64) {
            this.attachments.add(OutboundAttachment.ofBase64(name, contentType, contentBase64));
            return this;
        }

        public Builder inReplyTo(String inReplyTo) {
            this.inReplyTo = inReplyTo;
            return this;
        }

        public Builder linkedConversationId(Long linkedConversationId) {
            this.linkedConversationId = linkedConversationId;
            return this;
        }

        public Builder linkedContactId(Long linkedContactId) {
            this.linkedContactId = linkedContactId;
            return this;
        }

        public Builder linkedPropertyId(Long linkedPropertyId) {
            this.linkedPropertyId = linkedPropertyId;
            return this;
        }

        public Builder templateUsed(String templateUsed) {
            this.templateUsed = templateUsed;
            return this;
        }

        public SendEmailRequest build() {
            return new SendEmailRequest(this);
        }
    }
}
