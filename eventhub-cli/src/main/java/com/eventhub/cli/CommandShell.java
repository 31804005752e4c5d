/*
 * Copyright (c) 2025 EventHub
 * Licensed under the Apache License, Version 2.0
 */
package com.eventhub.cli;

import com.eventhub.api.IEventCatalog;
import com.eventhub.api.Outcome;
import com.eventhub.api.Result;
import com.eventhub.api.model.Attendee;
import com.eventhub.api.model.Event;
import com.eventhub.api.model.EventField;
import com.eventhub.api.model.EventStatus;
import com.eventhub.api.model.InventoryItem;
import com.eventhub.api.model.Role;
import com.eventhub.api.model.User;
import com.eventhub.api.report.AttendanceReport;
import com.eventhub.api.report.InventoryReport;
import com.eventhub.codec.AttendeeRecordCodec;
import com.eventhub.codec.EventRecordCodec;
import com.eventhub.codec.InventoryRecordCodec;
import com.eventhub.codec.UserRecordCodec;
import com.eventhub.infra.persistence.PersistenceException;
import com.eventhub.infra.persistence.RecordCollection;
import com.eventhub.report.ReportBuilder;
import com.eventhub.report.ReportExporter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Line-oriented front end over an {@link IEventCatalog}.
 *
 * <p>Each line is a command word optionally followed by arguments separated
 * by {@code |}, for example {@code allocate 1|2|5}. Admin commands require an
 * admin to be signed in; registration commands require a regular user.
 */
public class CommandShell {
    private static final Logger logger = Logger.getLogger(CommandShell.class.getName());

    static final String PROMPT = "eventhub> ";
    private static final String ARGUMENT_SEPARATOR = "\\|";

    private final IEventCatalog catalog;
    private final ReportBuilder reports;
    private final ReportExporter exporter;
    private final BufferedReader in;
    private final PrintWriter out;

    private User currentUser;

    public CommandShell(IEventCatalog catalog, ReportExporter exporter, BufferedReader in, PrintWriter out) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.reports = new ReportBuilder(catalog);
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Reads and executes commands until {@code quit} or end of input.
     */
    public void run() throws IOException {
        out.println("EventHub. Type 'help' for commands.");
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null || !execute(line)) {
                break;
            }
        }
        out.println("Goodbye.");
        out.flush();
    }

    /**
     * Executes one command line.
     *
     * @return {@code false} when the shell should stop
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        int space = trimmed.indexOf(' ');
        String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        List<String> args = space < 0 ? List.of() : splitArguments(trimmed.substring(space + 1));

        try {
            return dispatch(command, args);
        } catch (NumberFormatException e) {
            out.println("Expected a number: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            out.println("Invalid argument: " + e.getMessage());
        } catch (PersistenceException e) {
            logger.log(Level.SEVERE, "Command '" + command + "' could not be saved", e);
            out.println("Error: changes could not be saved (" + e.getMessage() + ")");
        }
        out.flush();
        return true;
    }

    public Optional<User> getCurrentUser() {
        return Optional.ofNullable(currentUser);
    }

    private boolean dispatch(String command, List<String> args) {
        switch (command) {
            case "quit", "exit" -> {
                return false;
            }
            case "help" -> printHelp();
            case "login" -> login(args);
            case "logout" -> logout();
            case "events" -> listEvents(catalog.events());
            case "search" -> listEvents(catalog.searchEvents(joined(args)));
            case "items" -> {
                if (requireSignedIn()) listItems();
            }
            case "register" -> {
                if (requireRegularUser()) register(args);
            }
            case "cancel" -> {
                if (requireRegularUser()) report(catalog.cancelRegistration(currentUser, intArg(args, 0)));
            }
            case "contact" -> {
                if (requireRegularUser()) report(catalog.updateContactInfo(currentUser, joined(args)));
            }
            case "create-event" -> {
                if (requireAdmin()) createEvent(args);
            }
            case "edit-event" -> {
                if (requireAdmin()) report(catalog.editEvent(intArg(args, 0),
                        EventField.valueOf(arg(args, 1).toUpperCase(Locale.ROOT)), arg(args, 2)));
            }
            case "status" -> {
                if (requireAdmin()) report(catalog.updateEventStatus(intArg(args, 0),
                        EventStatus.valueOf(arg(args, 1).toUpperCase(Locale.ROOT))));
            }
            case "delete-event" -> {
                if (requireAdmin()) report(catalog.deleteEvent(intArg(args, 0)));
            }
            case "check-in" -> {
                if (requireAdmin()) report(catalog.checkIn(intArg(args, 0), intArg(args, 1)));
            }
            case "attendees" -> {
                if (requireAdmin()) listAttendees(intArg(args, 0));
            }
            case "add-item" -> {
                if (requireAdmin()) addItem(args);
            }
            case "set-total" -> {
                if (requireAdmin()) report(catalog.setItemTotal(intArg(args, 0), intArg(args, 1)));
            }
            case "allocate" -> {
                if (requireAdmin()) report(catalog.allocateToEvent(intArg(args, 0), intArg(args, 1), intArg(args, 2)));
            }
            case "deallocate" -> {
                if (requireAdmin()) deallocate(args);
            }
            case "report" -> {
                if (requireAdmin()) writeReport(args);
            }
            case "export" -> {
                if (requireAdmin()) export(args);
            }
            case "users" -> {
                if (requireAdmin()) listUsers();
            }
            case "add-user" -> {
                if (requireAdmin()) addUser(args);
            }
            case "delete-user" -> {
                if (requireAdmin()) report(catalog.deleteUser(arg(args, 0), currentUser));
            }
            default -> out.println("Unknown command '" + command + "'. Type 'help' for commands.");
        }
        out.flush();
        return true;
    }

    // ==================== Session ====================

    private void login(List<String> args) {
        Optional<User> user = catalog.authenticate(arg(args, 0), arg(args, 1));
        if (user.isEmpty()) {
            out.println("Invalid username or password.");
            return;
        }
        currentUser = user.get();
        out.println("Welcome, " + currentUser.username() + (currentUser.isAdmin() ? " (admin)" : "") + ".");
    }

    private void logout() {
        if (currentUser != null) {
            out.println("Signed out " + currentUser.username() + ".");
        }
        currentUser = null;
    }

    private boolean requireSignedIn() {
        if (currentUser == null) {
            out.println("Please log in first.");
            return false;
        }
        return true;
    }

    private boolean requireAdmin() {
        if (!requireSignedIn()) {
            return false;
        }
        if (!currentUser.isAdmin()) {
            report(Outcome.NOT_PERMITTED);
            return false;
        }
        return true;
    }

    private boolean requireRegularUser() {
        if (!requireSignedIn()) {
            return false;
        }
        if (currentUser.isAdmin()) {
            report(Outcome.NOT_PERMITTED);
            return false;
        }
        return true;
    }

    // ==================== Commands ====================

    private void register(List<String> args) {
        Result<Attendee> result = catalog.registerForEvent(currentUser, intArg(args, 0), arg(args, 1));
        if (result.isOk()) {
            out.println("Registered as attendee " + result.value().getId() + ".");
        } else {
            report(result.outcome());
        }
    }

    private void createEvent(List<String> args) {
        Result<Event> result = catalog.createEvent(arg(args, 0), arg(args, 1), arg(args, 2),
                optionalArg(args, 3), optionalArg(args, 4), optionalArg(args, 5));
        if (result.isOk()) {
            out.println("Created event " + result.value().getId() + ".");
        } else {
            report(result.outcome());
        }
    }

    private void addItem(List<String> args) {
        Result<InventoryItem> result = catalog.addItem(arg(args, 0), intArg(args, 1), optionalArg(args, 2));
        if (result.isOk()) {
            out.println("Added item " + result.value().getId() + ".");
        } else {
            report(result.outcome());
        }
    }

    private void deallocate(List<String> args) {
        Result<Integer> result = catalog.deallocateFromEvent(intArg(args, 0), intArg(args, 1), intArg(args, 2));
        if (result.isOk()) {
            out.println("Deallocated " + result.value() + " unit(s).");
        } else {
            report(result.outcome());
        }
    }

    private void addUser(List<String> args) {
        Role role = args.size() > 2 ? Role.valueOf(arg(args, 2).toUpperCase(Locale.ROOT)) : Role.REGULAR_USER;
        Result<User> result = catalog.createUser(arg(args, 0), arg(args, 1), role);
        if (result.isOk()) {
            out.println("Created user " + result.value().username() + ".");
        } else {
            report(result.outcome());
        }
    }

    private void writeReport(List<String> args) {
        String kind = arg(args, 0).toLowerCase(Locale.ROOT);
        switch (kind) {
            case "attendance" -> {
                int eventId = intArg(args, 1);
                Optional<AttendanceReport> report = reports.attendance(eventId);
                if (report.isEmpty()) {
                    report(Outcome.EVENT_NOT_FOUND);
                    return;
                }
                printAttendance(report.get());
                Path file = exporter.writeJson(report.get(), "attendance_event_" + eventId + ".json");
                out.println("Saved to " + file);
            }
            case "inventory" -> {
                InventoryReport report = reports.inventory();
                printInventory(report);
                Path file = exporter.writeJson(report, "inventory_report.json");
                out.println("Saved to " + file);
            }
            default -> out.println("Usage: report attendance|<eventId>  or  report inventory");
        }
    }

    private void export(List<String> args) {
        String what = arg(args, 0).toLowerCase(Locale.ROOT);
        Path file;
        switch (what) {
            case "event-attendees" -> {
                int eventId = intArg(args, 1);
                Optional<Event> event = catalog.findEvent(eventId);
                if (event.isEmpty()) {
                    report(Outcome.EVENT_NOT_FOUND);
                    return;
                }
                file = exporter.writeAttendeeList(event.get(), catalog.attendeesForEvent(eventId));
            }
            case "events" -> file = exporter.exportCollection(RecordCollection.EVENTS,
                    catalog.events(), new EventRecordCodec());
            case "attendees" -> file = exporter.exportCollection(RecordCollection.ATTENDEES,
                    catalog.attendees(), new AttendeeRecordCodec());
            case "inventory" -> file = exporter.exportCollection(RecordCollection.INVENTORY,
                    catalog.items(), new InventoryRecordCodec());
            case "users" -> file = exporter.exportCollection(RecordCollection.USERS,
                    catalog.users(), new UserRecordCodec());
            default -> {
                out.println("Usage: export events|attendees|inventory|users  or  export event-attendees|<eventId>");
                return;
            }
        }
        out.println("Exported to " + file);
    }

    // ==================== Output ====================

    private void listEvents(List<Event> events) {
        if (events.isEmpty()) {
            out.println("No events found.");
            return;
        }
        for (Event event : events) {
            out.printf("[%d] %s | %s %s | %s | %s | %s | %d registered%n",
                    event.getId(), event.getName(), event.getDate(), event.getTime(), event.getLocation(),
                    event.getCategory(), event.getStatus().label(), event.getAttendeeIds().size());
        }
    }

    private void listItems() {
        List<InventoryItem> items = catalog.items();
        if (items.isEmpty()) {
            out.println("No inventory items.");
            return;
        }
        for (InventoryItem item : items) {
            out.printf("[%d] %s | total %d | allocated %d | available %d | %s%n",
                    item.getId(), item.getName(), item.getTotalQuantity(), item.getAllocatedQuantity(),
                    item.getAvailableQuantity(), item.getDescription());
        }
    }

    private void listAttendees(int eventId) {
        if (catalog.findEvent(eventId).isEmpty()) {
            report(Outcome.EVENT_NOT_FOUND);
            return;
        }
        List<Attendee> attendees = catalog.attendeesForEvent(eventId);
        if (attendees.isEmpty()) {
            out.println("No attendees registered for this event.");
            return;
        }
        for (Attendee attendee : attendees) {
            out.printf("[%d] %s | %s | %s%n", attendee.getId(), attendee.getName(), attendee.getContactInfo(),
                    attendee.isCheckedIn() ? "Checked In" : "Not Checked In");
        }
    }

    private void listUsers() {
        for (User user : catalog.users()) {
            out.printf("[%d] %s | %s%n", user.id(), user.username(), user.role());
        }
    }

    private void printAttendance(AttendanceReport report) {
        out.printf("Attendance for '%s' (%s %s)%n", report.eventName(), report.date(), report.time());
        for (AttendanceReport.Entry entry : report.entries()) {
            if (entry.known()) {
                out.printf("  [%d] %s | %s | %s%n", entry.attendeeId(), entry.name(), entry.contactInfo(),
                        entry.checkedIn() ? "Checked In" : "Not Checked In");
            } else {
                out.printf("  [%d] (unknown attendee)%n", entry.attendeeId());
            }
        }
        out.printf("Registered: %d, checked in: %d (%.2f%%)%n",
                report.registered(), report.checkedIn(), report.attendancePercentage());
    }

    private void printInventory(InventoryReport report) {
        for (InventoryReport.Row row : report.rows()) {
            out.printf("  [%d] %s | total %d | allocated %d | available %d%n",
                    row.itemId(), row.name(), row.total(), row.allocated(), row.available());
        }
        out.printf("Totals: %d total, %d allocated, %d available%n",
                report.totalQuantity(), report.totalAllocated(), report.totalAvailable());
        for (InventoryReport.EventAllocation allocation : report.allocationsByEvent()) {
            out.printf("  Event [%d] %s%n", allocation.eventId(), allocation.eventName());
            for (InventoryReport.Line line : allocation.lines()) {
                out.printf("    %s x %d%n", line.itemName(), line.quantity());
            }
        }
    }

    private void report(Outcome outcome) {
        out.println(outcome.isOk() ? "Done." : outcome.message() + ".");
    }

    private void printHelp() {
        out.println("Commands (arguments separated by '|'):");
        out.println("  login <user>|<password>, logout, events, search <term>, items, help, quit");
        out.println("  register <eventId>|<contact>, cancel <eventId>, contact <contact>");
        out.println("  create-event <name>|<YYYY-MM-DD>|<HH:MM>|<location>|<description>|<category>");
        out.println("  edit-event <eventId>|<field>|<value>, status <eventId>|<status>, delete-event <eventId>");
        out.println("  check-in <eventId>|<attendeeId>, attendees <eventId>");
        out.println("  add-item <name>|<total>|<description>, set-total <itemId>|<total>");
        out.println("  allocate <eventId>|<itemId>|<qty>, deallocate <eventId>|<itemId>|<qty>");
        out.println("  report attendance|<eventId>, report inventory");
        out.println("  export events|attendees|inventory|users, export event-attendees|<eventId>");
        out.println("  users, add-user <user>|<password>[|ADMIN], delete-user <user>");
    }

    // ==================== Arguments ====================

    static List<String> splitArguments(String raw) {
        List<String> args = new ArrayList<>();
        for (String part : raw.split(ARGUMENT_SEPARATOR, -1)) {
            args.add(part.trim());
        }
        return args;
    }

    private static String joined(List<String> args) {
        return String.join("|", args);
    }

    private static String arg(List<String> args, int index) {
        if (index >= args.size()) {
            throw new IllegalArgumentException("missing argument " + (index + 1));
        }
        return args.get(index);
    }

    private static String optionalArg(List<String> args, int index) {
        return index < args.size() ? args.get(index) : "";
    }

    private static int intArg(List<String> args, int index) {
        return Integer.parseInt(arg(args, index));
    }
}
