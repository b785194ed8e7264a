package command;

import lombok.extern.slf4j.Slf4j;
import model.CommandRequest;
import model.Reply;
import service.StorageService;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 모든 명령어를 관리하고, 요청에 맞는 명령어를 찾아 실행하는 핸들러 클래스
 *
 * <p>상태를 갖지 않으므로 여러 연결이 하나의 인스턴스를 공유합니다.
 */
@Slf4j
public class CommandHandler {

    private final Map<String, Command> commandMap = new HashMap<>();

    public CommandHandler(StorageService storageService) {
        this(storageService, Map.of());
    }

    /**
     * 기본 명령어에 추가 명령어를 더해 생성합니다. 같은 이름이면 추가 명령어가 우선합니다.
     */
    CommandHandler(StorageService storageService, Map<String, Command> extraCommands) {
        commandMap.put("ping", new PingCommand());
        commandMap.put("echo", new EchoCommand());
        commandMap.put("set", new SetCommand(storageService));
        commandMap.put("get", new GetCommand(storageService));
        extraCommands.forEach((name, command) -> commandMap.put(name.toLowerCase(Locale.ROOT), command));
    }

    public Reply handleCommand(CommandRequest request) {
        String commandName = request.name();
        Command command = commandMap.get(commandName.toLowerCase(Locale.ROOT));
        if (command == null) {
            return CommandErrors.unknownCommand(commandName);
        }

        try {
            return command.execute(request.args());
        } catch (RuntimeException e) {
            log.error("Command '{}' failed", commandName, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Reply.error("ERR " + message);
        }
    }
}
