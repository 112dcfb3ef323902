package com.trino.client.dbclient.impl.http;

import java.time.Duration;

/** Waits between retry attempts. */
@FunctionalInterface
interface Sleeper {

  Sleeper THREAD_SLEEPER = delay -> Thread.sleep(delay.toMillis());

  void sleep(Duration delay) throws InterruptedException;
}
