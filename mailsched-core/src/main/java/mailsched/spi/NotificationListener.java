package mailsched.spi;

import mailsched.model.Notification;

/**
 * Receives notifications after the unit of work that created them has committed.
 *
 * <p>Called on a pipeline worker thread; implementations should hand off slow work.
 * Exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface NotificationListener {

  void onNotification(Notification notification);
}
