package com.scholary.dubbing.session;

import com.scholary.dubbing.config.DubbingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes sessions older than the configured retention window. */
@Component
public class SessionReaper {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionReaper.class);

  private final SessionRegistry registry;
  private final DubbingProperties properties;

  public SessionReaper(SessionRegistry registry, DubbingProperties properties) {
    this.registry = registry;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${dubbing.session.reapInterval}",
      initialDelayString = "${dubbing.session.reapInterval}")
  public void reapExpiredSessions() {
    LOGGER.debug("Reaper tick: {} sessions registered", registry.size());
    registry.reap(properties.session().retention());
  }
}
