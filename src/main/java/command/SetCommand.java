package command;

import model.Key;
import model.Reply;
import protocol.RespProtocol;
import service.StorageService;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds]
 */
public class SetCommand implements Command {

    private final StorageService storageService;

    public SetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(List<byte[]> args) {
        if (args.size() < 2) {
            return CommandErrors.wrongArity("set");
        }

        Duration ttl = null;
        for (int i = 2; i < args.size(); i++) {
            String option = new String(args.get(i), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
            if (!"EX".equals(option) && !"PX".equals(option)) {
                return CommandErrors.SYNTAX_ERROR;
            }
            // EX와 PX를 함께 쓰거나 값이 빠진 경우
            if (ttl != null || i + 1 >= args.size()) {
                return CommandErrors.SYNTAX_ERROR;
            }

            Long amount = RespProtocol.parseInteger(args.get(++i));
            if (amount == null) {
                return CommandErrors.NOT_AN_INTEGER;
            }
            if (amount < 0 || ("EX".equals(option) && amount > Long.MAX_VALUE / 1000)) {
                return CommandErrors.invalidExpireTime("set");
            }
            ttl = "EX".equals(option) ? Duration.ofSeconds(amount) : Duration.ofMillis(amount);
        }

        storageService.set(new Key(args.get(0)), args.get(1), ttl);
        return Reply.OK;
    }
}
