package org.moxie.exposure.producers;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Clock;

@ApplicationScoped
public class ClockProducer {

  @Produces
  @ApplicationScoped
  public Clock produceClock() {
    return Clock.systemUTC();
  }
}
