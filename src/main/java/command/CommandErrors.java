package command;

import model.Reply;

/**
 * 명령어 검증 오류 응답
 */
final class CommandErrors {

    static final Reply SYNTAX_ERROR = Reply.error("ERR syntax error");
    static final Reply NOT_AN_INTEGER = Reply.error("ERR value is not an integer or out of range");

    private CommandErrors() {
    }

    static Reply wrongArity(String command) {
        return Reply.error("ERR wrong number of arguments for '" + command + "' command");
    }

    static Reply unknownCommand(String command) {
        return Reply.error("ERR unknown command '" + command + "'");
    }

    static Reply invalidExpireTime(String command) {
        return Reply.error("ERR invalid expire time in '" + command + "' command");
    }
}
