package com.jarvisbot.telegram.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/** Carries the submitting thread's MDC (correlation id) onto the worker thread. */
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    Map<String, String> parent = MDC.getCopyOfContextMap();
    return () -> {
      if (parent != null) {
        MDC.setContextMap(parent);
      }
      try {
        runnable.run();
      } finally {
        MDC.clear();
      }
    };
  }
}
