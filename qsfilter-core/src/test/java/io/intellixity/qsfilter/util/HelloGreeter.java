package io.intellixity.qsfilter.util;

public final class HelloGreeter implements Greeter {
  @Override
  public String greet(String name) { return "hello " + name; }
}
