package io.neocli.errors;

import java.util.List;

public interface ConsoleUi {
    void error(String message);

    void list(List<String> items);
}
