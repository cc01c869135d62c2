package mailqueue.model;

public record MailAddress(String name, String address) {
}
