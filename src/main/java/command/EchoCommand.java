package command;

import model.Reply;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public Reply execute(List<byte[]> args) {
        if (args.size() != 1) {
            return CommandErrors.wrongArity("echo");
        }
        return Reply.bulkString(args.get(0));
    }
}
