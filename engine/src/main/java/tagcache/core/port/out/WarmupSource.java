package tagcache.core.port.out;

import java.util.List;

import tagcache.core.model.WarmupEntry;

/**
 * Supplies frequently read values to preload at startup.
 *
 * <p>Clients expose implementations as CDI beans; each one is asked once when
 * warm-up is enabled.
 */
public interface WarmupSource {

    String name();

    List<WarmupEntry> entries();
}
