package mailqueue.testing;

import mailqueue.model.TokenGrant;
import mailqueue.spi.TokenRefresher;

import java.util.concurrent.atomic.AtomicInteger;

public class StubTokenRefresher implements TokenRefresher {
  public final AtomicInteger calls = new AtomicInteger();
  private final MutableClock clock;
  private volatile RuntimeException failure;
  private volatile boolean rotateRefreshToken = true;

  public StubTokenRefresher(MutableClock clock) {
    this.clock = clock;
  }

  public void failWith(RuntimeException failure) {
    this.failure = failure;
  }

  public void keepRefreshToken() {
    this.rotateRefreshToken = false;
  }

  @Override
  public TokenGrant refresh(String refreshToken, String tenantId) {
    int n = calls.incrementAndGet();
    if (failure != null) {
      throw failure;
    }
    return new TokenGrant("fresh-access-" + n, rotateRefreshToken ? "fresh-refresh-" + n : null,
        clock.instant().plusSeconds(3600));
  }
}
