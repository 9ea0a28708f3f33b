package com.responseready.sessionmonitor;

import java.util.Arrays;
import java.util.Optional;

/** User interactions that count as activity. */
public enum ActivityEvent {
  MOUSEDOWN("mousedown"),
  MOUSEMOVE("mousemove"),
  KEYPRESS("keypress"),
  SCROLL("scroll"),
  TOUCHSTART("touchstart"),
  CLICK("click");

  private final String eventName;

  ActivityEvent(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }

  /** Maps a raw UI event name; anything untracked is empty. */
  public static Optional<ActivityEvent> fromEventName(String name) {
    return Arrays.stream(values()).filter(e -> e.eventName.equals(name)).findFirst();
  }
}
