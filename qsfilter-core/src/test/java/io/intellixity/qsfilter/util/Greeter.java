package io.intellixity.qsfilter.util;

public interface Greeter {
  String greet(String name);
}
