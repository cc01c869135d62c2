package mailqueue.model;

public record JobStats(long pending, long processing, long completed, long failed, long dead) {
  public static final JobStats EMPTY = new JobStats(0, 0, 0, 0, 0);

  public long total() {
    return pending + processing + completed + failed + dead;
  }
}
