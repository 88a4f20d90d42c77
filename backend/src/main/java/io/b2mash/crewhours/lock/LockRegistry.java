package io.b2mash.crewhours.lock;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * In-process mutual exclusion keyed by entity id: a worker for clock transitions, a segment or a
 * work order for crew segment transitions. Locks are weakly held and disappear once no thread
 * references them.
 */
@Component
public class LockRegistry {

  private final Cache<UUID, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

  public <T> T withLock(UUID key, Supplier<T> action) {
    ReentrantLock lock = locks.get(key, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
