package command;

import model.Key;
import model.Reply;
import service.StorageService;

import java.util.List;

public class GetCommand implements Command {

    private final StorageService storageService;

    public GetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(List<byte[]> args) {
        if (args.size() != 1) {
            return CommandErrors.wrongArity("get");
        }
        // null이면 null bulk string으로 인코딩됨
        return Reply.bulkString(storageService.get(new Key(args.get(0))));
    }
}
