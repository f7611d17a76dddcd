package dev.univer.expensebot.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeDefault;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Arrays;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramWrapper extends TelegramLongPollingBot {

    private final TelegramProperties props;
    private final ApplicationEventPublisher publisher;

    @Override public String getBotUsername() { return props.getUsername(); }
    @Override public String getBotToken() { return props.getToken(); }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }

    public void installCommands() {
        List<BotCommand> commands = Arrays.asList(
                new BotCommand("/help", "Show help"),
                new BotCommand("/add", "Add an expense"),
                new BotCommand("/list", "Recent expenses"),
                new BotCommand("/today", "Today's expenses"),
                new BotCommand("/week", "This week's expenses"),
                new BotCommand("/edit", "Change an expense by id"),
                new BotCommand("/delete", "Delete an expense by id"),
                new BotCommand("/categories", "List categories"),
                new BotCommand("/category", "Expenses in a category"),
                new BotCommand("/addcategory", "Create a category"),
                new BotCommand("/renamecategory", "Rename a category"),
                new BotCommand("/deletecategory", "Delete a category"),
                new BotCommand("/tag", "Tag an expense"),
                new BotCommand("/untag", "Remove a tag"),
                new BotCommand("/tags", "Your tags"),
                new BotCommand("/currency", "Show or set default currency")
                                                 );
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(new BotCommandScopeDefault());
        try { execute(set); log.info("Bot commands installed: {}", commands.size()); }
        catch (TelegramApiException e) { log.warn("Failed to set bot commands", e); }
    }
}
