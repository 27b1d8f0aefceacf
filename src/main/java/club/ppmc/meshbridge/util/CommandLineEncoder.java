/**
 * CommandLineEncoder.java
 *
 * 将参数列表编码为 meshcli 能识别的一行命令。
 * meshcli 按空白自行切分参数，并且只识别双引号：含空白或引号的参数必须用双引号包裹，
 * 内部的双引号用反斜杠转义。单引号不会被 meshcli 去掉，所以不能用单引号包裹。
 */
package club.ppmc.meshbridge.util;

import club.ppmc.meshbridge.exception.MalformedCommandException;
import java.util.ArrayList;
import java.util.List;

public final class CommandLineEncoder {

    private CommandLineEncoder() {}

    /**
     * 编码一条命令。
     *
     * @param args 命令及其参数，不能为空。
     * @return 不含行终止符的命令行。
     * @throws MalformedCommandException 参数列表为空、含 null，或某个参数包含换行符。
     */
    public static String encode(List<String> args) {
        if (args == null || args.isEmpty()) {
            throw new MalformedCommandException("Command must contain at least one argument", -1);
        }
        List<String> quoted = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg == null) {
                throw new MalformedCommandException("Argument " + i + " is null", i);
            }
            if (arg.indexOf('\n') >= 0 || arg.indexOf('\r') >= 0) {
                throw new MalformedCommandException("Argument " + i + " contains a line terminator", i);
            }
            quoted.add(quote(arg));
        }
        return String.join(" ", quoted);
    }

    static String quote(String arg) {
        if (!needsQuoting(arg)) {
            return arg;
        }
        return '"' + arg.replace("\"", "\\\"") + '"';
    }

    private static boolean needsQuoting(String arg) {
        for (int i = 0; i < arg.length(); i++) {
            char c = arg.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '\'') {
                return true;
            }
        }
        return false;
    }
}
