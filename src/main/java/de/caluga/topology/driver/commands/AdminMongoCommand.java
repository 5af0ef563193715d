package de.caluga.topology.driver.commands;

/**
 * commands that always run against the admin database with value 1
 */
public abstract class AdminMongoCommand<T extends MongoCommand<T>> extends MongoCommand<T> {

    public AdminMongoCommand() {
        setDb("admin");
    }

    @Override
    protected Object getCommandValue() {
        return 1;
    }
}
