package dev.evidence;

/**
 * Progress callback for long verification runs. Failures thrown from a listener are logged and
 * ignored.
 */
public interface ProgressListener {

  ProgressListener NONE = new ProgressListener() {
    @Override
    public void start(int total) {
    }

    @Override
    public void increment() {
    }
  };

  void start(int total);

  void increment();
}
