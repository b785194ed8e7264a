package model;

import java.util.List;

/**
 * 프레임 하나에서 디코딩된 명령어 호출. 이름은 원래 대소문자를 유지합니다.
 */
public record CommandRequest(String name, List<byte[]> args) {
}
