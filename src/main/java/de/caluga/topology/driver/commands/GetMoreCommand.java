package de.caluga.topology.driver.commands;

public class GetMoreCommand extends MongoCommand<GetMoreCommand> {
    private transient long cursorId;
    private String collection;
    private Integer batchSize;
    private Integer maxTimeMS;

    public long getCursorId() {
        return cursorId;
    }

    public GetMoreCommand setCursorId(long cursorId) {
        this.cursorId = cursorId;
        return this;
    }

    @Override
    public GetMoreCommand setColl(String coll) {
        collection = coll;
        return super.setColl(coll);
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public GetMoreCommand setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public Integer getMaxTimeMS() {
        return maxTimeMS;
    }

    public GetMoreCommand setMaxTimeMS(Integer maxTimeMS) {
        this.maxTimeMS = maxTimeMS;
        return this;
    }

    @Override
    protected Object getCommandValue() {
        return cursorId;
    }

    @Override
    public String getCommandName() {
        return "getMore";
    }
}
