package dev.ebullient.mud;

import java.util.List;

import dev.ebullient.mud.model.RoomView;

/**
 * Plain-text layouts shared by the dispatcher and the login flow.
 * Lines are joined with {@code \n}; the transport adds the final line break.
 */
public class TextRenderer {

    public static final String WELCOME_BANNER = """
            Welcome to the San Antonio MUD
            Type 'login' to sign in or 'signup' to create a new account""";

    public static final String HELP = """
            === SAN ANTONIO MUD COMMANDS ===

            EXPLORING:
              look (l) - Show room description, exits, people, and items
              move <direction> (go) - Move to another room
              n/s/e/w/u/d - Quick movement
              where - Show your current location

            ITEMS:
              get <item> (take) - Pick up an item from the room
              drop <item> - Drop an item from your inventory
              inventory (inv/i) - Show what you're carrying

            NPCs:
              talk <npc> [keyword] - Talk to NPCs (try: history, food, music)

            COMMUNICATION:
              say <message> - Talk to people in the same room
              emote <action> - Act something out for the room
              whisper <player> <message> - Speak privately to one player
              shout <message> - Send message to all players
              who - Show online players

            SYSTEM:
              help - Show this help
              quit - Exit the MUD

            TIP: Most commands work with partial names!
                Example: 'get guitar' instead of 'get a tortoiseshell guitar pick'
            ===============================""";

    public static final String WELCOME_GUIDE = """
            === WELCOME GUIDE ===
            Here are some basic commands to get started:

            Exploring:
              'look' - See your surroundings, exits, people, and items
              'n/s/e/w' - Move north/south/east/west
              'where' - Check your current location

            Communication:
              'say <message>' - Talk to people in the same room
              'shout <message>' - Send message to everyone in the world
              'who' - See who's online

            Items:
              'get <item>' - Pick up items you find
              'drop <item>' - Drop items from your inventory
              'inventory' (or 'inv') - See what you're carrying

            NPCs:
              'talk <npc>' - Chat with characters (try keywords!)

            Need help? Type 'help' anytime!
            ==================""";

    private TextRenderer() {
    }

    public static String room(RoomView view) {
        StringBuilder sb = new StringBuilder();
        sb.append(view.name()).append('\n');
        sb.append(view.description()).append('\n');
        if (view.exits().isEmpty()) {
            sb.append("No obvious exits\n");
        } else {
            sb.append("Exits: ").append(String.join(", ", view.exits())).append('\n');
        }
        sb.append("Players here: ").append(StringUtils.listOrNone(view.otherOccupantNames())).append('\n');
        appendEntries(sb, "NPCs here", view.npcs());
        appendEntries(sb, "Items here", view.items());
        return sb.toString().stripTrailing();
    }

    public static String inventory(List<RoomView.Entry> items) {
        if (items.isEmpty()) {
            return "You're not carrying anything.";
        }
        StringBuilder sb = new StringBuilder("You are carrying:");
        for (RoomView.Entry item : items) {
            sb.append("\n  ").append(item.name()).append(" - ").append(item.description());
        }
        return sb.toString();
    }

    private static void appendEntries(StringBuilder sb, String label, List<RoomView.Entry> entries) {
        if (entries.isEmpty()) {
            sb.append(label).append(": none\n");
            return;
        }
        sb.append(label).append(":\n");
        for (RoomView.Entry e : entries) {
            sb.append("  ").append(e.name()).append(" - ").append(e.description()).append('\n');
        }
    }
}
