package de.caluga.topology.driver.commands;

import java.util.ArrayList;
import java.util.List;

public class KillCursorsCommand extends MongoCommand<KillCursorsCommand> {
    private List<Long> cursors;

    public List<Long> getCursors() {
        return cursors;
    }

    public KillCursorsCommand setCursors(List<Long> cursors) {
        this.cursors = cursors;
        return this;
    }

    public KillCursorsCommand addCursor(long id) {
        if (cursors == null) {
            cursors = new ArrayList<>();
        }

        cursors.add(id);
        return this;
    }

    @Override
    public String getCommandName() {
        return "killCursors";
    }
}
