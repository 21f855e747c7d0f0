package warden.core.port.out;

/**
 * A held refresh lock. Closing releases it; closing twice is a no-op.
 */
public interface RefreshLock extends AutoCloseable {

    String key();

    boolean isHeld();

    @Override
    void close();
}
