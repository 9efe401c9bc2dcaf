package TableFill.Model;

import java.util.List;

/**
 * Two distinct equivalence classes would be given the same state name.
 */
public class NameCollisionException extends MinimizationException {
    private final String name;

    public NameCollisionException(String name, List<String> firstClass, List<String> secondClass) {
        super("Classes " + firstClass + " and " + secondClass + " both map to state name '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
