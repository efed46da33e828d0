package ca.gc.cra.warper.application.warp;

import ca.gc.cra.warper.application.port.Notifier;
import ca.gc.cra.warper.domain.warp.Notification;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingNotifier implements Notifier {
  final List<Notification> published = new CopyOnWriteArrayList<>();
  volatile RuntimeException failure;
  volatile boolean closed;

  @Override
  public void publish(Notification notification) {
    RuntimeException toThrow = failure;
    if (toThrow != null) {
      throw toThrow;
    }
    published.add(notification);
  }

  @Override
  public void close() {
    closed = true;
  }
}
