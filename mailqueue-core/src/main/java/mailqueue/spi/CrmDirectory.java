package mailqueue.spi;

import java.util.OptionalLong;

/**
 * Read-only lookups into CRM tables owned by the host application. Matching is a
 * case-insensitive equality on the email address.
 */
public interface CrmDirectory {

    /**
     * Directory that never matches.
     */
    CrmDirectory NONE = new CrmDirectory() {
        @Override
        public OptionalLong findConversationId(String emailAddress) {
            return OptionalLong.empty();
        }

        @Override
        public OptionalLong findEnquiryId(String emailAddress) {
            return OptionalLong.empty();
        }

        @Override
        public OptionalLong findLeadId(String emailAddress) {
            return OptionalLong.empty();
        }
    };

    OptionalLong findConversationId(String emailAddress);

    OptionalLong findEnquiryId(String emailAddress);

    OptionalLong findLeadId(String emailAddress);
}
