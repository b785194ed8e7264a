package command;

import model.Reply;

import java.util.List;

public class PingCommand implements Command {
    @Override
    public Reply execute(List<byte[]> args) {
        if (args.isEmpty()) {
            return Reply.PONG;
        }
        if (args.size() == 1) {
            return Reply.bulkString(args.get(0));
        }
        return CommandErrors.wrongArity("ping");
    }
}
